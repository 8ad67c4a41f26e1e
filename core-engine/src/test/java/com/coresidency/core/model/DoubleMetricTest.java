package com.coresidency.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DoubleMetric} and {@link MetricValues}.
 */
class DoubleMetricTest {

    @Test
    @DisplayName("Division by zero yields the neutral element")
    void shouldDivideByZeroToNeutral() {
        assertThat(DoubleMetric.of(42).dividedBy(0)).isEqualTo(DoubleMetric.ZERO);
        assertThat(DoubleMetric.of(42).dividedBy(0).isZero()).isTrue();
    }

    @Test
    @DisplayName("Distance is the absolute difference")
    void shouldComputeAbsoluteDistance() {
        assertThat(DoubleMetric.of(3).distance(DoubleMetric.of(5)).doubleValue()).isEqualTo(2.0);
        assertThat(DoubleMetric.of(5).distance(DoubleMetric.of(3)).doubleValue()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Exceeds is strict")
    void shouldCompareStrictlyAgainstBound() {
        assertThat(DoubleMetric.of(1.0).exceeds(1.0)).isFalse();
        assertThat(DoubleMetric.of(1.01).exceeds(1.0)).isTrue();
        assertThat(DoubleMetric.of(2).compareTo(DoubleMetric.of(1))).isPositive();
    }

    @Test
    @DisplayName("Coercion rejects null and non-finite input")
    void shouldRejectUnusableInput() {
        assertThatThrownBy(() -> MetricValues.of(null)).isInstanceOf(InvalidSampleBatchException.class);
        assertThatThrownBy(() -> MetricValues.of(Double.NaN)).isInstanceOf(InvalidSampleBatchException.class);
        assertThatThrownBy(() -> MetricValues.of(new Object())).isInstanceOf(InvalidSampleBatchException.class);
        assertThat(MetricValues.of(" 7 ").doubleValue()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Overflowing sums and distances saturate instead of failing")
    void shouldSaturateOnOverflow() {
        DoubleMetric huge = DoubleMetric.of(1.0e308);

        assertThat(huge.plus(huge).doubleValue()).isEqualTo(Double.MAX_VALUE);
        assertThat(DoubleMetric.of(-1.0e308).plus(DoubleMetric.of(-1.0e308)).doubleValue())
                .isEqualTo(-Double.MAX_VALUE);
        assertThat(huge.distance(DoubleMetric.of(-1.0e308)).doubleValue()).isEqualTo(Double.MAX_VALUE);
        assertThat(huge.plus(huge).dividedBy(2).doubleValue()).isEqualTo(Double.MAX_VALUE / 2);
    }
}
