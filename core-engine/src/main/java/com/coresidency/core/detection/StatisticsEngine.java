package com.coresidency.core.detection;

import com.coresidency.core.model.HostState;
import com.coresidency.core.model.MetricValue;
import com.coresidency.core.model.SampleBatch;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes population averages over the hosts it is given, normally the
 * included hosts that are not under mitigation.
 *
 * <p>
 * A host's contribution to a metric is either its latest sample or, when
 * normalization is enabled, the average of that metric over the host's own
 * window, so that hosts with fewer retained samples are not penalized by
 * window fill level. Each metric is averaged over the hosts that report it.
 * {@value SampleBatch#ACTIVITY} is never averaged.
 * </p>
 *
 * <p>
 * Stateless: averages are recomputed from the host windows on every call.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticsEngine {

    /**
     * @param included  hosts participating in the population
     * @param normalize use window averages instead of latest samples
     * @return averages per metric
     */
    public PopulationStatistics compute(Collection<HostState> included, boolean normalize) {
        Objects.requireNonNull(included, "Included hosts must not be null");
        if (included.isEmpty()) {
            return PopulationStatistics.empty();
        }

        Map<String, MetricValue> sums = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (HostState host : included) {
            for (String metric : host.latest().keySet()) {
                if (SampleBatch.ACTIVITY.equals(metric)) {
                    continue;
                }
                Optional<MetricValue> value = hostValue(host, metric, normalize);
                if (value.isEmpty()) {
                    continue;
                }
                sums.merge(metric, value.get(), MetricValue::plus);
                counts.merge(metric, 1, Integer::sum);
            }
        }

        Map<String, MetricValue> averages = new LinkedHashMap<>();
        sums.forEach((metric, sum) -> averages.put(metric, sum.dividedBy(counts.get(metric))));
        return new PopulationStatistics(averages, included.size());
    }

    /**
     * The value a host contributes for one metric.
     *
     * @param host      host state
     * @param metric    metric name
     * @param normalize average over the host's window instead of taking the
     *                  latest sample
     * @return the host's value, or empty if the host never reported
     *         {@code metric}
     */
    public Optional<MetricValue> hostValue(HostState host, String metric, boolean normalize) {
        if (!normalize) {
            return Optional.ofNullable(host.latest().get(metric));
        }

        MetricValue sum = null;
        int count = 0;
        for (Map<String, MetricValue> sample : host.window()) {
            MetricValue value = sample.get(metric);
            if (value == null) {
                continue;
            }
            sum = sum == null ? value : sum.plus(value);
            count++;
        }
        return sum == null ? Optional.empty() : Optional.of(sum.dividedBy(count));
    }
}
