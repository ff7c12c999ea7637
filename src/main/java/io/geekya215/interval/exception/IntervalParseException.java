package io.geekya215.interval.exception;

public class IntervalParseException extends RuntimeException {
    private static final String TEMPLATE = "Cannot parse \"%s\" as an interval: %s";

    private final String text;

    public IntervalParseException(CharSequence text, String reason) {
        super(String.format(TEMPLATE, text, reason));
        this.text = String.valueOf(text);
    }

    public IntervalParseException(CharSequence text, String reason, Throwable cause) {
        super(String.format(TEMPLATE, text, reason), cause);
        this.text = String.valueOf(text);
    }

    public String getText() {
        return text;
    }
}
