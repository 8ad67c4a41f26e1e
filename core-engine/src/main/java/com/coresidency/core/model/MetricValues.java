package com.coresidency.core.model;

/**
 * Coercion of loosely typed sample values into {@link MetricValue}s.
 *
 * <p>
 * Handles {@link Number} subclasses natively and attempts
 * {@link Double#parseDouble(String)} for string-encoded numbers. Values that
 * are already {@code MetricValue}s pass through untouched.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricValues {

    private MetricValues() {
        // utility class: not instantiable
    }

    /**
     * @param raw value as reported by the collector
     * @return the value as a {@link MetricValue}
     * @throws InvalidSampleBatchException if {@code raw} is {@code null} or not
     *                                     numeric-like
     */
    public static MetricValue of(Object raw) {
        if (raw instanceof MetricValue m) {
            return m;
        }
        if (raw instanceof Number n) {
            return finite(n.doubleValue(), raw);
        }
        if (raw instanceof String s) {
            try {
                return finite(Double.parseDouble(s.trim()), raw);
            } catch (NumberFormatException e) {
                throw new InvalidSampleBatchException("Value is not numeric: '" + s + "'", e);
            }
        }
        throw new InvalidSampleBatchException("Value is not numeric: " + raw);
    }

    private static MetricValue finite(double value, Object raw) {
        if (!Double.isFinite(value)) {
            throw new InvalidSampleBatchException("Value is not finite: " + raw);
        }
        return DoubleMetric.of(value);
    }
}
