package com.coresidency.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one mitigation transition for one host.
 *
 * <p>
 * The event bus payload of a start/stop event is the bare host ID; this class
 * is what the detector reports to observers and what the service serializes to
 * JSON.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code hostId}, {@code action} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class MitigationDecision {

    private String hostId;
    private MitigationAction action;
    private Instant timestamp;

    /** Version string of the configuration the deciding batch ran against. */
    private String configurationVersion;

    /** Human-readable description of the transition. */
    private String details;

    /** No-arg constructor required by Jackson. */
    public MitigationDecision() {
    }

    private MitigationDecision(Builder builder) {
        this.hostId = Objects.requireNonNull(builder.hostId, "hostId must not be null");
        this.action = Objects.requireNonNull(builder.action, "action must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.configurationVersion = builder.configurationVersion;
        this.details = builder.details;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MitigationDecision} instances.
     */
    public static class Builder {
        private String hostId;
        private MitigationAction action;
        private Instant timestamp;
        private String configurationVersion;
        private String details;

        public Builder hostId(String hostId) {
            this.hostId = hostId;
            return this;
        }

        public Builder action(MitigationAction action) {
            this.action = action;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder configurationVersion(String configurationVersion) {
            this.configurationVersion = configurationVersion;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public MitigationDecision build() {
            return new MitigationDecision(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getHostId() {
        return hostId;
    }

    public void setHostId(String hostId) {
        this.hostId = hostId;
    }

    public MitigationAction getAction() {
        return action;
    }

    public void setAction(MitigationAction action) {
        this.action = action;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getConfigurationVersion() {
        return configurationVersion;
    }

    public void setConfigurationVersion(String configurationVersion) {
        this.configurationVersion = configurationVersion;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MitigationDecision that))
            return false;
        return Objects.equals(hostId, that.hostId)
                && action == that.action
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostId, action, timestamp);
    }

    @Override
    public String toString() {
        return "MitigationDecision{" +
                "hostId='" + hostId + '\'' +
                ", action=" + action +
                ", timestamp=" + timestamp +
                ", configurationVersion='" + configurationVersion + '\'' +
                ", details='" + details + '\'' +
                '}';
    }
}
