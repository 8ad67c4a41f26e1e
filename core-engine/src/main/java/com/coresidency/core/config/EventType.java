package com.coresidency.core.config;

import java.util.Optional;

/**
 * The four logical events the detector exchanges over the event bus.
 *
 * <p>
 * Each logical event maps to a configurable wire name; the defaults below are
 * used when the configuration does not override them.
 * </p>
 *
 * @since 1.0.0
 */
public enum EventType {

    /** Payload: sample batch. Caller → detector. */
    SAMPLE_EVENT("SampleEvent", "MetricsSampled"),

    /** Payload: host ID. Detector → caller. */
    START_MITIGATION("StartMitigation", "MitigationStart"),

    /** Payload: host ID. Detector → caller. */
    STOP_MITIGATION("StopMitigation", "MitigationStop"),

    /** Payload: new configuration. Manager → detector. */
    CONFIGURATION_RELOADED("ConfigurationReloaded", "ConfigurationReloaded");

    private final String logicalName;
    private final String defaultWireName;

    EventType(String logicalName, String defaultWireName) {
        this.logicalName = logicalName;
        this.defaultWireName = defaultWireName;
    }

    /**
     * @return key used for this event under {@code EventNames} in the
     *         configuration file
     */
    public String logicalName() {
        return logicalName;
    }

    public String defaultWireName() {
        return defaultWireName;
    }

    /**
     * @param logicalName configuration key, e.g. {@code StartMitigation}
     * @return the matching event type, or empty if the key is unknown
     */
    public static Optional<EventType> fromLogicalName(String logicalName) {
        for (EventType type : values()) {
            if (type.logicalName.equals(logicalName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
