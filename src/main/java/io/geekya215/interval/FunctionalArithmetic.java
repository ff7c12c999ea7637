package io.geekya215.interval;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BiFunction;

final class FunctionalArithmetic<T, D> implements Arithmetic<T, D> {
    static final Arithmetic<Integer, Integer> INTEGERS =
            new FunctionalArithmetic<Integer, Integer>(Math::subtractExact, Math::addExact, Math::subtractExact);
    static final Arithmetic<Long, Long> LONGS =
            new FunctionalArithmetic<Long, Long>(Math::subtractExact, Math::addExact, Math::subtractExact);
    static final Arithmetic<Double, Double> DOUBLES =
            new FunctionalArithmetic<Double, Double>((a, b) -> a - b, Double::sum, (a, b) -> a - b);
    static final Arithmetic<BigDecimal, BigDecimal> BIG_DECIMALS =
            new FunctionalArithmetic<BigDecimal, BigDecimal>(BigDecimal::subtract, BigDecimal::add, BigDecimal::subtract);
    static final Arithmetic<Instant, Duration> INSTANTS =
            new FunctionalArithmetic<Instant, Duration>((a, b) -> Duration.between(b, a), Instant::plus, Instant::minus);

    private final @NotNull BiFunction<? super T, ? super T, ? extends D> difference;
    private final @NotNull BiFunction<? super T, ? super D, ? extends T> add;
    private final @NotNull BiFunction<? super T, ? super D, ? extends T> subtract;

    FunctionalArithmetic(
            @NotNull BiFunction<? super T, ? super T, ? extends D> difference,
            @NotNull BiFunction<? super T, ? super D, ? extends T> add,
            @NotNull BiFunction<? super T, ? super D, ? extends T> subtract) {
        this.difference = Objects.requireNonNull(difference, "difference");
        this.add = Objects.requireNonNull(add, "add");
        this.subtract = Objects.requireNonNull(subtract, "subtract");
    }

    @Override
    public @NotNull D difference(@NotNull T minuend, @NotNull T subtrahend) {
        return Objects.requireNonNull(difference.apply(minuend, subtrahend), "difference result");
    }

    @Override
    public @NotNull T add(@NotNull T point, @NotNull D amount) {
        return Objects.requireNonNull(add.apply(point, amount), "add result");
    }

    @Override
    public @NotNull T subtract(@NotNull T point, @NotNull D amount) {
        return Objects.requireNonNull(subtract.apply(point, amount), "subtract result");
    }
}
