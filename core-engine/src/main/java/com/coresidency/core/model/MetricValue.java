package com.coresidency.core.model;

/**
 * Minimal numeric capability every metric value must provide.
 *
 * <p>
 * The detector never inspects concrete metric types: population averages,
 * window averages and deviations are all computed through this interface, so
 * callers may report custom metric kinds as long as they can be added,
 * divided by a count and ordered.
 * </p>
 *
 * <h3>Neutral element</h3>
 * <p>
 * Dividing by a count of zero yields the type's neutral element rather than
 * failing; an empty window therefore contributes nothing to an average.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricValue extends Comparable<MetricValue> {

    /**
     * @param other value to add; must not be {@code null}
     * @return the sum of this value and {@code other}
     */
    MetricValue plus(MetricValue other);

    /**
     * @param count divisor; a count of zero yields the neutral element
     * @return this value divided by {@code count}
     */
    MetricValue dividedBy(int count);

    /**
     * Absolute difference between this value and {@code other}.
     *
     * @param other value to compare with; must not be {@code null}
     * @return non-negative distance
     */
    MetricValue distance(MetricValue other);

    /**
     * @return {@code true} if this value equals the neutral element
     */
    boolean isZero();

    /**
     * @return this value as a {@code double}, used for threshold comparison and
     *         serialization
     */
    double doubleValue();

    /**
     * Whether this value is strictly greater than a configured bound.
     *
     * @param bound deviation bound from the configuration
     * @return {@code true} if this value exceeds {@code bound}
     */
    default boolean exceeds(double bound) {
        return Double.compare(doubleValue(), bound) > 0;
    }
}
