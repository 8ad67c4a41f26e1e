package com.coresidency.core.detection;

import com.coresidency.core.model.MetricValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Population averages of one batch, one per non-activity metric.
 *
 * @since 1.0.0
 */
public final class PopulationStatistics {

    private static final PopulationStatistics EMPTY = new PopulationStatistics(Map.of(), 0);

    private final Map<String, MetricValue> averages;
    private final int populationSize;

    PopulationStatistics(Map<String, MetricValue> averages, int populationSize) {
        this.averages = Collections.unmodifiableMap(new LinkedHashMap<>(averages));
        this.populationSize = populationSize;
    }

    static PopulationStatistics empty() {
        return EMPTY;
    }

    /**
     * @param metric metric name
     * @return the population average, or empty if no included host reported
     *         {@code metric}
     */
    public Optional<MetricValue> average(String metric) {
        return Optional.ofNullable(averages.get(metric));
    }

    /**
     * @return unmodifiable metric name → average map
     */
    public Map<String, MetricValue> getAverages() {
        return averages;
    }

    /**
     * @return number of included hosts the averages were computed over
     */
    public int getPopulationSize() {
        return populationSize;
    }

    @Override
    public String toString() {
        return "PopulationStatistics{hosts=" + populationSize + ", averages=" + averages + '}';
    }
}
