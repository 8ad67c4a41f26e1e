package com.coresidency.core.detection;

import com.coresidency.core.config.DetectorConfiguration;
import com.coresidency.core.model.DoubleMetric;
import com.coresidency.core.model.HostState;
import com.coresidency.core.model.SampleBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DeviationEvaluator}.
 */
class DeviationEvaluatorTest {

    private final StatisticsEngine statisticsEngine = new StatisticsEngine();
    private final DeviationEvaluator evaluator = new DeviationEvaluator(statisticsEngine);

    private final DetectorConfiguration config = DetectorConfiguration.builder()
            .threshold("NrConnections", 1.0)
            .threshold("NrPackets", 100.0)
            .normalizeSamples(false)
            .build();

    @Test
    @DisplayName("A single metric over its bound is enough to trigger")
    void shouldTriggerOnAnyMetric() {
        HostState suspect = host("1", 10, 50);
        HostState benign = host("2", 2, 50);
        PopulationStatistics stats = statisticsEngine.compute(List.of(suspect, benign), false);

        DeviationVerdict verdict = evaluator.evaluate(suspect, stats, config);

        // average connections = 6, deviation 4 > 1; packets deviation 0
        assertThat(verdict.isOverThreshold()).isTrue();
        assertThat(verdict.getExceededMetrics()).containsExactly("NrConnections");
        assertThat(verdict.getDeviations().get("NrConnections").doubleValue()).isEqualTo(4.0);
        assertThat(verdict.getDeviations().get("NrPackets").doubleValue()).isZero();
    }

    @Test
    @DisplayName("Deviation equal to the bound does not trigger")
    void shouldNotTriggerAtBound() {
        HostState a = host("1", 3, 0);
        HostState b = host("2", 1, 0);
        PopulationStatistics stats = statisticsEngine.compute(List.of(a, b), false);

        // average = 2, deviation = 1 == bound
        assertThat(evaluator.evaluate(a, stats, config).isOverThreshold()).isFalse();
    }

    @Test
    @DisplayName("Metrics without a threshold are not compared")
    void shouldSkipUnthresholdedMetrics() {
        DetectorConfiguration connectionsOnly = DetectorConfiguration.builder()
                .threshold("NrConnections", 1.0)
                .normalizeSamples(false)
                .build();
        HostState a = host("1", 1, 1_000);
        HostState b = host("2", 1, 0);
        PopulationStatistics stats = statisticsEngine.compute(List.of(a, b), false);

        DeviationVerdict verdict = evaluator.evaluate(a, stats, connectionsOnly);

        assertThat(verdict.getDeviations()).containsOnlyKeys("NrConnections");
        assertThat(verdict.isOverThreshold()).isFalse();
    }

    private static HostState host(String id, double connections, double packets) {
        HostState host = new HostState(id, 5);
        host.record(Map.of(
                SampleBatch.ACTIVITY, DoubleMetric.of(1),
                "NrConnections", DoubleMetric.of(connections),
                "NrPackets", DoubleMetric.of(packets)));
        host.include();
        return host;
    }
}
