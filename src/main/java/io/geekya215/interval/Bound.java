package io.geekya215.interval;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public sealed interface Bound<T extends Comparable<? super T>> permits Bound.Included, Bound.Excluded {
    static <T extends Comparable<? super T>> @NotNull Included<T> included(@NotNull T point) {
        return new Included<>(point);
    }

    static <T extends Comparable<? super T>> @NotNull Excluded<T> excluded(@NotNull T point) {
        return new Excluded<>(point);
    }

    static <T extends Comparable<? super T>> @NotNull Bound<T> of(@NotNull T point) {
        return included(point);
    }

    // Java has no type-level default value, so the zero point is supplied by the caller
    static <T extends Comparable<? super T>> @NotNull Bound<T> defaultOf(@NotNull T zero) {
        return included(zero);
    }

    @NotNull T point();

    boolean isClosed();

    default boolean isOpen() {
        return !isClosed();
    }

    @NotNull Bound<T> withPoint(@NotNull T point);

    // NOTICE
    // intersect* closes a shared point only if both bounds are closed, union* if either is
    default @NotNull Bound<T> intersectOrLeast(@NotNull Bound<T> other) {
        int cmp = point().compareTo(other.point());
        if (cmp == 0) {
            return isClosed() && other.isClosed() ? this : excluded(point());
        }
        return cmp < 0 ? this : other;
    }

    default @NotNull Bound<T> intersectOrGreatest(@NotNull Bound<T> other) {
        int cmp = point().compareTo(other.point());
        if (cmp == 0) {
            return isClosed() && other.isClosed() ? this : excluded(point());
        }
        return cmp > 0 ? this : other;
    }

    default @NotNull Bound<T> unionOrLeast(@NotNull Bound<T> other) {
        int cmp = point().compareTo(other.point());
        if (cmp == 0) {
            return isOpen() && other.isOpen() ? this : included(point());
        }
        return cmp < 0 ? this : other;
    }

    default @NotNull Bound<T> unionOrGreatest(@NotNull Bound<T> other) {
        int cmp = point().compareTo(other.point());
        if (cmp == 0) {
            return isOpen() && other.isOpen() ? this : included(point());
        }
        return cmp > 0 ? this : other;
    }

    record Included<T extends Comparable<? super T>>(@NotNull T point) implements Bound<T> {
        public Included {
            Objects.requireNonNull(point, "point");
        }

        @Override
        public boolean isClosed() {
            return true;
        }

        @Override
        public @NotNull Bound<T> withPoint(@NotNull T point) {
            return new Included<>(point);
        }
    }

    record Excluded<T extends Comparable<? super T>>(@NotNull T point) implements Bound<T> {
        public Excluded {
            Objects.requireNonNull(point, "point");
        }

        @Override
        public boolean isClosed() {
            return false;
        }

        @Override
        public @NotNull Bound<T> withPoint(@NotNull T point) {
            return new Excluded<>(point);
        }
    }
}
