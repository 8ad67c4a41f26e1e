package com.coresidency.core.detection;

import com.coresidency.core.config.DetectorConfiguration;
import com.coresidency.core.model.HostState;
import com.coresidency.core.model.MetricValue;
import com.coresidency.core.model.SampleBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares a host's metrics against the population averages.
 *
 * <p>
 * For each thresholded metric, {@code deviation = |hostValue − average|}. The
 * host is over threshold when <em>any</em> deviation is strictly greater than
 * its configured bound.
 * </p>
 *
 * @since 1.0.0
 */
public class DeviationEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(DeviationEvaluator.class);

    private final StatisticsEngine statisticsEngine;

    public DeviationEvaluator(StatisticsEngine statisticsEngine) {
        this.statisticsEngine = Objects.requireNonNull(statisticsEngine, "StatisticsEngine must not be null");
    }

    /**
     * @param host          host to evaluate
     * @param statistics    population averages of the current batch
     * @param configuration snapshot the batch runs against
     * @return per-metric deviations and the metrics that exceeded their bound
     */
    public DeviationVerdict evaluate(HostState host, PopulationStatistics statistics,
            DetectorConfiguration configuration) {
        Map<String, MetricValue> deviations = new LinkedHashMap<>();
        List<String> exceeded = new ArrayList<>();

        for (String metric : host.latest().keySet()) {
            if (SampleBatch.ACTIVITY.equals(metric)) {
                continue;
            }
            if (!configuration.hasThreshold(metric)) {
                // Only reachable for metrics recorded before a reload dropped their threshold.
                LOG.debug("Host {}: no threshold for '{}', skipping comparison", host.hostId(), metric);
                continue;
            }
            Optional<MetricValue> average = statistics.average(metric);
            Optional<MetricValue> value = statisticsEngine.hostValue(host, metric,
                    configuration.isNormalizeSamples());
            if (average.isEmpty() || value.isEmpty()) {
                continue;
            }

            MetricValue deviation = value.get().distance(average.get());
            deviations.put(metric, deviation);
            if (deviation.exceeds(configuration.threshold(metric))) {
                exceeded.add(metric);
            }
        }

        DeviationVerdict verdict = new DeviationVerdict(host.hostId(), deviations, exceeded);
        if (verdict.isOverThreshold()) {
            LOG.debug("Host {} over threshold on {}: deviations={}", host.hostId(), exceeded, deviations);
        }
        return verdict;
    }
}
