package io.geekya215.interval;

import io.geekya215.interval.exception.IntervalParseException;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Function;

import static io.geekya215.interval.Bound.excluded;
import static io.geekya215.interval.Bound.included;

// reads the Interval#toString notation, e.g. [0, 2)
public final class IntervalParser {
    private IntervalParser() {
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> parse(
            @NotNull CharSequence text, @NotNull Function<String, ? extends T> converter) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(converter, "converter");

        String trimmed = text.toString().strip();
        if (trimmed.length() < 2) {
            throw new IntervalParseException(text, "missing brackets");
        }

        boolean leftClosed = switch (trimmed.charAt(0)) {
            case '[' -> true;
            case '(' -> false;
            default -> throw new IntervalParseException(text, "expected '[' or '(' at start");
        };
        boolean rightClosed = switch (trimmed.charAt(trimmed.length() - 1)) {
            case ']' -> true;
            case ')' -> false;
            default -> throw new IntervalParseException(text, "expected ']' or ')' at end");
        };

        String body = trimmed.substring(1, trimmed.length() - 1);
        int comma = body.indexOf(',');
        if (comma < 0 || comma != body.lastIndexOf(',')) {
            throw new IntervalParseException(text, "expected exactly one ',' between the points");
        }

        T left = convert(text, body.substring(0, comma).strip(), converter);
        T right = convert(text, body.substring(comma + 1).strip(), converter);
        return Interval.of(
                leftClosed ? included(left) : excluded(left),
                rightClosed ? included(right) : excluded(right));
    }

    private static <T> @NotNull T convert(
            @NotNull CharSequence text, @NotNull String token, @NotNull Function<String, ? extends T> converter) {
        if (token.isEmpty()) {
            throw new IntervalParseException(text, "missing point");
        }

        T point;
        try {
            point = converter.apply(token);
        } catch (RuntimeException e) {
            throw new IntervalParseException(text, "invalid point '" + token + "'", e);
        }

        if (point == null) {
            throw new IntervalParseException(text, "invalid point '" + token + "'");
        }
        return point;
    }
}
