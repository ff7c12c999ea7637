package io.geekya215.interval;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BiFunction;

// D is the distance between two points of T, e.g. Duration for Instant
public interface Arithmetic<T, D> {
    @NotNull D difference(@NotNull T minuend, @NotNull T subtrahend);

    @NotNull T add(@NotNull T point, @NotNull D amount);

    @NotNull T subtract(@NotNull T point, @NotNull D amount);

    static <T, D> @NotNull Arithmetic<T, D> of(
            @NotNull BiFunction<? super T, ? super T, ? extends D> difference,
            @NotNull BiFunction<? super T, ? super D, ? extends T> add,
            @NotNull BiFunction<? super T, ? super D, ? extends T> subtract) {
        return new FunctionalArithmetic<>(difference, add, subtract);
    }

    // NOTICE
    // integers() and longs() throw ArithmeticException on overflow
    static @NotNull Arithmetic<Integer, Integer> integers() {
        return FunctionalArithmetic.INTEGERS;
    }

    static @NotNull Arithmetic<Long, Long> longs() {
        return FunctionalArithmetic.LONGS;
    }

    static @NotNull Arithmetic<Double, Double> doubles() {
        return FunctionalArithmetic.DOUBLES;
    }

    static @NotNull Arithmetic<BigDecimal, BigDecimal> bigDecimals() {
        return FunctionalArithmetic.BIG_DECIMALS;
    }

    static @NotNull Arithmetic<Instant, Duration> instants() {
        return FunctionalArithmetic.INSTANTS;
    }
}
