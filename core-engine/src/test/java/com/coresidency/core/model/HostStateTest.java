package com.coresidency.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HostState}.
 */
class HostStateTest {

    private HostState host;

    @BeforeEach
    void setUp() {
        host = new HostState("1", 3);
    }

    @Test
    @DisplayName("Window never holds more than its capacity and evicts the oldest sample")
    void shouldEvictOldestOnOverflow() {
        for (int i = 1; i <= 5; i++) {
            host.record(sample(1, i));
            assertThat(host.windowSize()).isLessThanOrEqualTo(3);
        }

        assertThat(host.window())
                .extracting(s -> s.get("NrConnections").doubleValue())
                .containsExactly(3.0, 4.0, 5.0);
        assertThat(host.latest().get("NrConnections").doubleValue()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Activity run-lengths reset on the opposite activity")
    void shouldTrackActivityRunLengths() {
        host.record(sample(1, 0));
        host.record(sample(1, 0));
        assertThat(host.consecutiveActive()).isEqualTo(2);
        assertThat(host.consecutiveInactive()).isZero();

        host.record(sample(0, 0));
        assertThat(host.consecutiveActive()).isZero();
        assertThat(host.consecutiveInactive()).isEqualTo(1);
    }

    @Test
    @DisplayName("Shrinking the capacity trims the oldest samples")
    void shouldTrimOnShrink() {
        for (int i = 1; i <= 3; i++) {
            host.record(sample(1, i));
        }

        host.resize(1);

        assertThat(host.capacity()).isEqualTo(1);
        assertThat(host.window()).hasSize(1);
        assertThat(host.latest().get("NrConnections").doubleValue()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Flagging resets deflags and transitions reset both counters")
    void shouldResetCountersOnTransition() {
        host.flag();
        host.flag();
        assertThat(host.flagCount()).isEqualTo(2);

        host.startMitigating();
        assertThat(host.isMitigating()).isTrue();
        assertThat(host.flagCount()).isZero();

        host.deflag();
        assertThat(host.deflagCount()).isEqualTo(1);
        host.stopMitigating();
        assertThat(host.isMitigating()).isFalse();
        assertThat(host.deflagCount()).isZero();
    }

    @Test
    @DisplayName("Snapshot reflects the current state")
    void shouldSnapshot() {
        host.record(sample(1, 7));
        host.include();
        host.flag();

        HostSnapshot snapshot = host.snapshot();

        assertThat(snapshot.getHostId()).isEqualTo("1");
        assertThat(snapshot.getWindowSize()).isEqualTo(1);
        assertThat(snapshot.getCapacity()).isEqualTo(3);
        assertThat(snapshot.isIncluded()).isTrue();
        assertThat(snapshot.getFlagCount()).isEqualTo(1);
        assertThat(snapshot.isMitigating()).isFalse();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new HostState("1", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<String, MetricValue> sample(int activity, double connections) {
        return Map.of(
                SampleBatch.ACTIVITY, DoubleMetric.of(activity),
                "NrConnections", DoubleMetric.of(connections));
    }
}
