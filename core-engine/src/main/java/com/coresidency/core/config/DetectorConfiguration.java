package com.coresidency.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration snapshot of the co-residency detector.
 *
 * <p>
 * A snapshot is never mutated; a reload produces a new instance which the
 * detector swaps in as a whole. Every batch therefore runs against exactly one
 * snapshot.
 * </p>
 *
 * <h3>Window rules</h3>
 * <p>
 * {@code samplesBeforeInclusion} and {@code samplesBeforeExclusion} accept
 * {@value #FULL_WINDOW}, meaning "a full window" of active respectively
 * inactive samples, i.e. {@code maxSamples} consecutive rounds.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link ConfigurationParser} to read a configuration file, or the
 * {@link Builder} for programmatic / test scenarios. The builder validates all
 * values at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorConfiguration {

    /** Sentinel for the window-size inclusion/exclusion rules. */
    public static final int FULL_WINDOW = -1;

    private final String version;
    private final boolean mitigationEnabled;
    private final int flagsBeforeActivation;
    private final int deflagsBeforeDeactivation;
    private final Map<String, Double> thresholds;
    private final int samplesBeforeInclusion;
    private final int samplesBeforeExclusion;
    private final boolean normalizeSamples;
    private final int maxSamples;
    private final EventNames eventNames;

    private DetectorConfiguration(Builder b) {
        this.version = b.version;
        this.mitigationEnabled = b.mitigationEnabled;
        this.flagsBeforeActivation = b.flagsBeforeActivation;
        this.deflagsBeforeDeactivation = b.deflagsBeforeDeactivation;
        this.thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(b.thresholds));
        this.samplesBeforeInclusion = b.samplesBeforeInclusion;
        this.samplesBeforeExclusion = b.samplesBeforeExclusion;
        this.normalizeSamples = b.normalizeSamples;
        this.maxSamples = b.maxSamples;
        this.eventNames = EventNames.of(b.eventNames);
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @param metric metric name
     * @return {@code true} if a deviation bound is configured for
     *         {@code metric}; a bound for the reserved {@code Activity} metric
     *         is accepted but never used
     */
    public boolean hasThreshold(String metric) {
        return thresholds.containsKey(metric);
    }

    /**
     * @param metric metric name
     * @return the configured deviation bound
     * @throws IllegalArgumentException if no bound is configured
     */
    public double threshold(String metric) {
        Double bound = thresholds.get(metric);
        if (bound == null) {
            throw new IllegalArgumentException("No threshold configured for metric: " + metric);
        }
        return bound;
    }

    /**
     * @return consecutive active rounds needed before an excluded host is
     *         included, with {@value #FULL_WINDOW} resolved to
     *         {@code maxSamples}
     */
    public int inclusionRunLength() {
        return samplesBeforeInclusion == FULL_WINDOW ? maxSamples : samplesBeforeInclusion;
    }

    /**
     * @return consecutive inactive rounds needed before an included host is
     *         excluded, with {@value #FULL_WINDOW} resolved to
     *         {@code maxSamples}
     */
    public int exclusionRunLength() {
        return samplesBeforeExclusion == FULL_WINDOW ? maxSamples : samplesBeforeExclusion;
    }

    public String wireName(EventType type) {
        return eventNames.wireName(type);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return free-text version from the configuration source, or {@code null}
     */
    public String getVersion() {
        return version;
    }

    public boolean isMitigationEnabled() {
        return mitigationEnabled;
    }

    public int getFlagsBeforeActivation() {
        return flagsBeforeActivation;
    }

    public int getDeflagsBeforeDeactivation() {
        return deflagsBeforeDeactivation;
    }

    /**
     * @return unmodifiable metric name → deviation bound map
     */
    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    public int getSamplesBeforeInclusion() {
        return samplesBeforeInclusion;
    }

    public int getSamplesBeforeExclusion() {
        return samplesBeforeExclusion;
    }

    public boolean isNormalizeSamples() {
        return normalizeSamples;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public EventNames getEventNames() {
        return eventNames;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this snapshot's values
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .version(version)
                .mitigationEnabled(mitigationEnabled)
                .flagsBeforeActivation(flagsBeforeActivation)
                .deflagsBeforeDeactivation(deflagsBeforeDeactivation)
                .thresholds(thresholds)
                .samplesBeforeInclusion(samplesBeforeInclusion)
                .samplesBeforeExclusion(samplesBeforeExclusion)
                .normalizeSamples(normalizeSamples)
                .maxSamples(maxSamples);
        eventNames.asMap().forEach(b::eventName);
        return b;
    }

    /**
     * Fluent builder for {@link DetectorConfiguration}.
     *
     * <p>
     * {@link #build()} collects every invalid value and reports them together in
     * one {@link MalformedConfigurationException}.
     * </p>
     */
    public static class Builder {
        private String version;
        private boolean mitigationEnabled = true;
        private int flagsBeforeActivation = 3;
        private int deflagsBeforeDeactivation = 3;
        private final Map<String, Double> thresholds = new LinkedHashMap<>();
        private int samplesBeforeInclusion = FULL_WINDOW;
        private int samplesBeforeExclusion = FULL_WINDOW;
        private boolean normalizeSamples = true;
        private int maxSamples = 10;
        private final Map<EventType, String> eventNames = new EnumMap<>(EventType.class);

        public Builder version(String v) {
            this.version = v;
            return this;
        }

        public Builder mitigationEnabled(boolean v) {
            this.mitigationEnabled = v;
            return this;
        }

        public Builder flagsBeforeActivation(int v) {
            this.flagsBeforeActivation = v;
            return this;
        }

        public Builder deflagsBeforeDeactivation(int v) {
            this.deflagsBeforeDeactivation = v;
            return this;
        }

        public Builder threshold(String metric, double bound) {
            this.thresholds.put(metric, bound);
            return this;
        }

        /**
         * Replace all thresholds.
         *
         * @param v metric name → deviation bound
         * @return this builder
         */
        public Builder thresholds(Map<String, Double> v) {
            this.thresholds.clear();
            if (v != null) {
                this.thresholds.putAll(v);
            }
            return this;
        }

        public Builder samplesBeforeInclusion(int v) {
            this.samplesBeforeInclusion = v;
            return this;
        }

        public Builder samplesBeforeExclusion(int v) {
            this.samplesBeforeExclusion = v;
            return this;
        }

        public Builder normalizeSamples(boolean v) {
            this.normalizeSamples = v;
            return this;
        }

        public Builder maxSamples(int v) {
            this.maxSamples = v;
            return this;
        }

        public Builder eventName(EventType type, String wireName) {
            this.eventNames.put(Objects.requireNonNull(type, "Event type must not be null"), wireName);
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectorConfiguration}
         * @throws MalformedConfigurationException if any value is invalid
         */
        public DetectorConfiguration build() {
            List<String> errors = new ArrayList<>();

            if (flagsBeforeActivation < 1) {
                errors.add("FlagsBeforeActivation must be >= 1, got: " + flagsBeforeActivation);
            }
            if (deflagsBeforeDeactivation < 1) {
                errors.add("DeflagsBeforeDeactivation must be >= 1, got: " + deflagsBeforeDeactivation);
            }
            if (maxSamples < 1) {
                errors.add("MaxSamples must be >= 1, got: " + maxSamples);
            }
            requireRunLength(samplesBeforeInclusion, "SamplesBeforeInclusion", errors);
            requireRunLength(samplesBeforeExclusion, "SamplesBeforeExclusion", errors);

            thresholds.forEach((metric, bound) -> {
                if (metric == null || metric.isBlank()) {
                    errors.add("Threshold metric names must not be blank");
                } else if (bound == null || !Double.isFinite(bound) || bound < 0) {
                    errors.add("Threshold for '" + metric + "' must be a finite number >= 0, got: " + bound);
                }
            });

            eventNames.forEach((type, name) -> {
                if (name == null || name.isBlank()) {
                    errors.add("Event name for " + type.logicalName() + " must not be blank");
                }
            });

            if (!errors.isEmpty()) {
                throw new MalformedConfigurationException(errors);
            }
            return new DetectorConfiguration(this);
        }

        private static void requireRunLength(int value, String name, List<String> errors) {
            if (value != FULL_WINDOW && value < 1) {
                errors.add(name + " must be " + FULL_WINDOW + " or >= 1, got: " + value);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfiguration that))
            return false;
        return mitigationEnabled == that.mitigationEnabled
                && flagsBeforeActivation == that.flagsBeforeActivation
                && deflagsBeforeDeactivation == that.deflagsBeforeDeactivation
                && samplesBeforeInclusion == that.samplesBeforeInclusion
                && samplesBeforeExclusion == that.samplesBeforeExclusion
                && normalizeSamples == that.normalizeSamples
                && maxSamples == that.maxSamples
                && Objects.equals(version, that.version)
                && thresholds.equals(that.thresholds)
                && eventNames.equals(that.eventNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, mitigationEnabled, flagsBeforeActivation,
                deflagsBeforeDeactivation, thresholds, samplesBeforeInclusion,
                samplesBeforeExclusion, normalizeSamples, maxSamples, eventNames);
    }

    @Override
    public String toString() {
        return "DetectorConfiguration{" +
                "version='" + version + '\'' +
                ", mitigationEnabled=" + mitigationEnabled +
                ", flagsBeforeActivation=" + flagsBeforeActivation +
                ", deflagsBeforeDeactivation=" + deflagsBeforeDeactivation +
                ", thresholds=" + thresholds +
                ", samplesBeforeInclusion=" + samplesBeforeInclusion +
                ", samplesBeforeExclusion=" + samplesBeforeExclusion +
                ", normalizeSamples=" + normalizeSamples +
                ", maxSamples=" + maxSamples +
                ", eventNames=" + eventNames +
                '}';
    }
}
