package io.geekya215.interval;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Optional;

import static io.geekya215.interval.Bound.excluded;
import static io.geekya215.interval.Bound.included;

// NOTICE
// left point never exceeds right point, crop and extend are the only mutators and are not thread safe
public final class Interval<T extends Comparable<? super T>> {
    private static final Logger LOG = LoggerFactory.getLogger(Interval.class);

    private @NotNull Bound<T> start;
    private @NotNull Bound<T> end;

    private Interval(@NotNull Bound<T> start, @NotNull Bound<T> end) {
        this.start = start;
        this.end = end;
    }

    // bounds on the same point are closed if either one is closed
    public static <T extends Comparable<? super T>> @NotNull Interval<T> of(
            @NotNull Bound<T> start, @NotNull Bound<T> end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        return new Interval<>(start.unionOrLeast(end), start.unionOrGreatest(end));
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> of(@NotNull Bound<T> bound) {
        Objects.requireNonNull(bound, "bound");
        return new Interval<>(bound, bound);
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> point(@NotNull T point) {
        return closed(point, point);
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> defaultOf(@NotNull T zero) {
        return point(zero);
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> open(@NotNull T start, @NotNull T end) {
        return of(excluded(start), excluded(end));
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> closed(@NotNull T start, @NotNull T end) {
        return of(included(start), included(end));
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> leftOpen(@NotNull T start, @NotNull T end) {
        return of(excluded(start), included(end));
    }

    public static <T extends Comparable<? super T>> @NotNull Interval<T> rightOpen(@NotNull T start, @NotNull T end) {
        return of(included(start), excluded(end));
    }

    public @NotNull T leftPoint() {
        return start.point();
    }

    public @NotNull T rightPoint() {
        return end.point();
    }

    public @NotNull Bound<T> leftBound() {
        return start;
    }

    public @NotNull Bound<T> rightBound() {
        return end;
    }

    public boolean isEmpty() {
        return start.equals(end) && start.isOpen();
    }

    public @NotNull Optional<Interval<T>> toNonEmpty() {
        return isEmpty() ? Optional.empty() : Optional.of(copy());
    }

    public boolean contains(@NotNull T point) {
        int left = point.compareTo(leftPoint());
        int right = point.compareTo(rightPoint());
        return left > 0 && right < 0
                || left == 0 && start.isClosed()
                || right == 0 && end.isClosed();
    }

    public @NotNull Interval<T> copy() {
        return new Interval<>(start, end);
    }

    public @NotNull Optional<Interval<T>> intersect(@NotNull Interval<T> other) {
        if (isEmpty() || other.isEmpty()) {
            return Optional.empty();
        }

        Bound<T> lower = start.intersectOrGreatest(other.start);
        Bound<T> upper = end.intersectOrLeast(other.end);

        // [0, 0] and (0, 5) are disjoint in either order
        int cmp = lower.point().compareTo(upper.point());
        if (cmp > 0 || cmp == 0 && (lower.isOpen() || upper.isOpen())) {
            return Optional.empty();
        }
        return Optional.of(of(lower, upper));
    }

    public @NotNull Optional<Interval<T>> union(@NotNull Interval<T> other) {
        if (isEmpty() && other.isEmpty()) {
            return Optional.empty();
        } else if (isEmpty()) {
            return Optional.of(other.copy());
        } else if (other.isEmpty()) {
            return Optional.of(copy());
        }

        Interval<T> a = this;
        Interval<T> b = other;
        if (leftPoint().compareTo(other.leftPoint()) > 0) {
            a = other;
            b = this;
        }

        int gap = a.rightPoint().compareTo(b.leftPoint());
        if (gap < 0 || gap == 0 && a.end.isOpen() && b.start.isOpen()) {
            return Optional.empty();
        }
        return Optional.of(new Interval<>(a.start.unionOrLeast(b.start), a.end.unionOrGreatest(b.end)));
    }

    public static <T extends Comparable<? super T>> @NotNull Optional<Interval<T>> enclose(
            @NotNull Iterable<Interval<T>> intervals) {
        @Nullable Interval<T> hull = null;
        for (Interval<T> next : intervals) {
            if (next.isEmpty()) {
                continue;
            }
            hull = hull == null
                    ? next.copy()
                    : of(hull.start.unionOrLeast(next.start), hull.end.unionOrGreatest(next.end));
        }
        return Optional.ofNullable(hull);
    }

    // NOTICE
    // single greedy pass in input order: each interval is merged into the first output entry it unions with,
    // merged entries are not revisited, so the output is neither sorted nor guaranteed minimal
    public static <T extends Comparable<? super T>> @NotNull List<Interval<T>> normalize(
            @NotNull Iterable<Interval<T>> intervals) {
        List<Interval<T>> normalized = new ArrayList<>();
        Iterator<Interval<T>> iterator = intervals.iterator();
        while (iterator.hasNext()) {
            Interval<T> next = iterator.next();
            if (next.isEmpty()) {
                continue;
            }

            boolean merged = false;
            ListIterator<Interval<T>> entries = normalized.listIterator();
            while (entries.hasNext()) {
                Interval<T> entry = entries.next();
                Optional<Interval<T>> union = entry.union(next);
                if (union.isPresent()) {
                    LOG.debug("merge {} into {} as {}", next, entry, union.get());
                    entries.set(union.get());
                    merged = true;
                    break;
                }
            }

            if (!merged) {
                LOG.debug("append disjoint {}", next);
                normalized.add(next.copy());
            }
        }
        return normalized;
    }

    public <D> @NotNull D width(@NotNull Arithmetic<T, D> arithmetic) {
        return arithmetic.difference(rightPoint(), leftPoint());
    }

    public <D> void leftCrop(@NotNull Arithmetic<T, D> arithmetic, @NotNull D amount) {
        reorder(start.withPoint(arithmetic.add(leftPoint(), amount)), end);
    }

    public <D> void rightCrop(@NotNull Arithmetic<T, D> arithmetic, @NotNull D amount) {
        reorder(start, end.withPoint(arithmetic.subtract(rightPoint(), amount)));
    }

    public <D> void leftExtend(@NotNull Arithmetic<T, D> arithmetic, @NotNull D amount) {
        reorder(start.withPoint(arithmetic.subtract(leftPoint(), amount)), end);
    }

    public <D> void rightExtend(@NotNull Arithmetic<T, D> arithmetic, @NotNull D amount) {
        reorder(start, end.withPoint(arithmetic.add(rightPoint(), amount)));
    }

    private void reorder(@NotNull Bound<T> left, @NotNull Bound<T> right) {
        if (left.point().compareTo(right.point()) > 0) {
            LOG.debug("shift moved {} past {}, swapping ends", left, right);
        }
        start = left.unionOrLeast(right);
        end = left.unionOrGreatest(right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Interval<?> other)) {
            return false;
        }
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return (start.isOpen() ? "(" : "[") + leftPoint() + ", " + rightPoint() + (end.isOpen() ? ")" : "]");
    }
}
