package com.coresidency.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One round of metric samples: host ID → metric name → value.
 *
 * <p>
 * A batch is validated on construction and is immutable afterwards:
 * </p>
 * <ul>
 * <li>every host reports the mandatory {@value #ACTIVITY} metric, with a value
 * of {@code 0} or {@code 1};</li>
 * <li>every host reports the same metric key set;</li>
 * <li>every value is numeric-like (see {@link MetricValues#of(Object)}).</li>
 * </ul>
 * <p>
 * Host iteration order is the insertion order of the source map, which keeps
 * event emission deterministic when a batch sequence is replayed.
 * </p>
 *
 * @since 1.0.0
 */
public final class SampleBatch {

    /** Reserved metric carrying the per-round activity bit. Never thresholded. */
    public static final String ACTIVITY = "Activity";

    private static final SampleBatch EMPTY = new SampleBatch(Map.of(), Set.of());

    private final Map<String, Map<String, MetricValue>> samples;
    private final Set<String> metricNames;

    private SampleBatch(Map<String, Map<String, MetricValue>> samples, Set<String> metricNames) {
        this.samples = samples;
        this.metricNames = metricNames;
    }

    /**
     * @return a batch without hosts
     */
    public static SampleBatch empty() {
        return EMPTY;
    }

    /**
     * Validate and wrap raw samples.
     *
     * @param raw host ID → metric name → numeric-like value; must not be
     *            {@code null}
     * @return validated batch
     * @throws NullPointerException        if {@code raw} is {@code null}
     * @throws InvalidSampleBatchException if the batch violates any structural
     *                                     rule
     */
    public static SampleBatch of(Map<String, ? extends Map<String, ?>> raw) {
        Objects.requireNonNull(raw, "Sample batch must not be null");
        if (raw.isEmpty()) {
            return EMPTY;
        }

        Map<String, Map<String, MetricValue>> samples = new LinkedHashMap<>();
        Set<String> expectedKeys = null;
        String firstHost = null;

        for (Map.Entry<String, ? extends Map<String, ?>> entry : raw.entrySet()) {
            String hostId = entry.getKey();
            if (hostId == null || hostId.isBlank()) {
                throw new InvalidSampleBatchException("Host ID must not be null or blank");
            }
            Map<String, ?> metrics = entry.getValue();
            if (metrics == null) {
                throw new InvalidSampleBatchException("Host " + hostId + " reported no metrics");
            }
            if (!metrics.containsKey(ACTIVITY)) {
                throw new InvalidSampleBatchException(
                        "Host " + hostId + " is missing the mandatory '" + ACTIVITY + "' metric");
            }

            if (expectedKeys == null) {
                expectedKeys = new LinkedHashSet<>(metrics.keySet());
                firstHost = hostId;
            } else if (!expectedKeys.equals(metrics.keySet())) {
                throw new InvalidSampleBatchException(
                        "Host " + hostId + " reported metrics " + metrics.keySet()
                                + " but host " + firstHost + " reported " + expectedKeys);
            }

            Map<String, MetricValue> converted = new LinkedHashMap<>();
            for (Map.Entry<String, ?> metric : metrics.entrySet()) {
                try {
                    converted.put(metric.getKey(), MetricValues.of(metric.getValue()));
                } catch (InvalidSampleBatchException e) {
                    throw new InvalidSampleBatchException(
                            "Host " + hostId + ", metric '" + metric.getKey() + "': " + e.getMessage(), e);
                }
            }

            double activity = converted.get(ACTIVITY).doubleValue();
            if (activity != 0.0 && activity != 1.0) {
                throw new InvalidSampleBatchException(
                        "Host " + hostId + " reported " + ACTIVITY + "=" + activity + ", expected 0 or 1");
            }

            samples.put(hostId, Collections.unmodifiableMap(converted));
        }

        return new SampleBatch(Collections.unmodifiableMap(samples),
                Collections.unmodifiableSet(expectedKeys));
    }

    /**
     * Validate an untyped payload, such as a map decoded from JSON, whose keys
     * and nested maps have not been checked yet.
     *
     * @param raw host ID → metric name → numeric-like value
     * @return validated batch
     * @throws InvalidSampleBatchException if a host ID or metric name is not a
     *                                     string, a host entry is not a map, or
     *                                     the batch violates any rule of
     *                                     {@link #of(Map)}
     */
    public static SampleBatch fromRaw(Map<?, ?> raw) {
        Objects.requireNonNull(raw, "Sample batch must not be null");
        Map<String, Map<String, Object>> typed = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String hostId)) {
                throw new InvalidSampleBatchException("Host ID must be a string, got: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                typed.put(hostId, null);
                continue;
            }
            if (!(entry.getValue() instanceof Map<?, ?> metrics)) {
                throw new InvalidSampleBatchException(
                        "Host " + hostId + " reported " + entry.getValue() + " instead of a metric map");
            }
            Map<String, Object> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> metric : metrics.entrySet()) {
                if (!(metric.getKey() instanceof String name)) {
                    throw new InvalidSampleBatchException(
                            "Host " + hostId + " reported a non-string metric name: " + metric.getKey());
                }
                converted.put(name, metric.getValue());
            }
            typed.put(hostId, converted);
        }
        return of(typed);
    }

    /**
     * @return unmodifiable host ID → metric map, in insertion order
     */
    public Map<String, Map<String, MetricValue>> samples() {
        return samples;
    }

    /**
     * @return unmodifiable set of host IDs in this batch
     */
    public Set<String> hostIds() {
        return samples.keySet();
    }

    /**
     * @return the metric key set shared by every host, {@value #ACTIVITY}
     *         included; empty for an empty batch
     */
    public Set<String> metricNames() {
        return metricNames;
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int size() {
        return samples.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SampleBatch that))
            return false;
        return samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return samples.hashCode();
    }

    @Override
    public String toString() {
        return "SampleBatch" + samples;
    }
}
