package com.coresidency.core.detection;

import com.coresidency.core.model.MetricValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of comparing one host against the population for one batch.
 *
 * @since 1.0.0
 */
public final class DeviationVerdict {

    private final String hostId;
    private final Map<String, MetricValue> deviations;
    private final List<String> exceededMetrics;

    DeviationVerdict(String hostId, Map<String, MetricValue> deviations, List<String> exceededMetrics) {
        this.hostId = hostId;
        this.deviations = Collections.unmodifiableMap(new LinkedHashMap<>(deviations));
        this.exceededMetrics = List.copyOf(exceededMetrics);
    }

    public String getHostId() {
        return hostId;
    }

    /**
     * @return metric name → absolute deviation from the population average
     */
    public Map<String, MetricValue> getDeviations() {
        return deviations;
    }

    /**
     * @return metrics whose deviation exceeded the configured bound
     */
    public List<String> getExceededMetrics() {
        return exceededMetrics;
    }

    /**
     * @return {@code true} if any single metric exceeded its bound
     */
    public boolean isOverThreshold() {
        return !exceededMetrics.isEmpty();
    }

    @Override
    public String toString() {
        return "DeviationVerdict{hostId='" + hostId + "', deviations=" + deviations
                + ", exceeded=" + exceededMetrics + '}';
    }
}
