package com.coresidency.core.detection;

/**
 * Raised when a sample batch reports a metric for which the active
 * configuration defines no threshold while mitigation is enabled.
 *
 * <p>
 * The batch is rejected before any host state is touched; the detector keeps
 * running and processes later batches normally.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationMismatchException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final String hostId;

    public ConfigurationMismatchException(String metric, String hostId) {
        super("Metric '" + metric + "' reported by host " + hostId + " has no configured threshold");
        this.metric = metric;
        this.hostId = hostId;
    }

    public String getMetric() {
        return metric;
    }

    public String getHostId() {
        return hostId;
    }
}
