package com.coresidency.core.model;

import java.util.Objects;

/**
 * Floating-point {@link MetricValue}.
 *
 * <p>
 * Mixed arithmetic with other {@code MetricValue} implementations goes through
 * {@link MetricValue#doubleValue()}. Sums and distances that overflow saturate
 * at {@code ±Double.MAX_VALUE}, so finite samples always produce finite
 * averages.
 * </p>
 *
 * @since 1.0.0
 */
public final class DoubleMetric implements MetricValue {

    /** Neutral element. */
    public static final DoubleMetric ZERO = new DoubleMetric(0.0);

    private final double value;

    private DoubleMetric(double value) {
        this.value = value;
    }

    /**
     * @param value finite value
     * @return metric wrapping {@code value}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public static DoubleMetric of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Metric value must be finite, got: " + value);
        }
        return value == 0.0 ? ZERO : new DoubleMetric(value);
    }

    @Override
    public MetricValue plus(MetricValue other) {
        Objects.requireNonNull(other, "Addend must not be null");
        return of(saturate(value + other.doubleValue()));
    }

    @Override
    public MetricValue dividedBy(int count) {
        if (count == 0) {
            return ZERO;
        }
        return of(value / count);
    }

    @Override
    public MetricValue distance(MetricValue other) {
        Objects.requireNonNull(other, "Operand must not be null");
        return of(saturate(Math.abs(value - other.doubleValue())));
    }

    /** Clamps an overflowed result of two finite operands to the largest finite magnitude. */
    private static double saturate(double result) {
        if (Double.isInfinite(result)) {
            return Math.copySign(Double.MAX_VALUE, result);
        }
        return result;
    }

    @Override
    public boolean isZero() {
        return value == 0.0;
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public int compareTo(MetricValue other) {
        return Double.compare(value, other.doubleValue());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DoubleMetric that))
            return false;
        return Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
