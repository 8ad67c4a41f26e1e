package com.coresidency.core.detection;

import com.coresidency.core.config.DetectorConfiguration;
import com.coresidency.core.model.HostState;
import com.coresidency.core.model.MitigationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-host flag/deflag state machine.
 *
 * <h3>States</h3>
 * <ul>
 * <li><b>Excluded</b>: not part of the population, never compared</li>
 * <li><b>Included / Normal</b>: over-threshold rounds add a flag; reaching
 * {@code flagsBeforeActivation} flags starts mitigation</li>
 * <li><b>Included / Mitigating</b>: non-triggering rounds add a deflag, an
 * over-threshold round resets deflags; reaching
 * {@code deflagsBeforeDeactivation} deflags stops mitigation</li>
 * </ul>
 * <p>
 * Flags do not decay on non-triggering rounds. Both counters reset after every
 * transition. When mitigation is disabled only inclusion is tracked.
 * </p>
 *
 * <h3>Inclusion</h3>
 * <p>
 * Inclusion and exclusion are decided after the counters, so a change takes
 * effect from the next batch. Exclusion does not stop an ongoing mitigation:
 * the host keeps mitigating until it is included again and deflagged.
 * </p>
 *
 * @since 1.0.0
 */
public class HysteresisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(HysteresisEngine.class);

    /**
     * Advance one host by one batch.
     *
     * @param host          host state to update
     * @param verdict       comparison result, or {@code null} if the host was not
     *                      compared this batch
     * @param configuration snapshot the batch runs against
     * @return the mitigation transition triggered by this batch, if any
     */
    public Optional<MitigationAction> advance(HostState host, DeviationVerdict verdict,
            DetectorConfiguration configuration) {
        Objects.requireNonNull(host, "HostState must not be null");
        Objects.requireNonNull(configuration, "Configuration must not be null");

        Optional<MitigationAction> transition = Optional.empty();
        if (verdict != null && configuration.isMitigationEnabled()) {
            transition = host.isMitigating()
                    ? whileMitigating(host, verdict.isOverThreshold(), configuration)
                    : whileNormal(host, verdict.isOverThreshold(), configuration);
        }

        updateInclusion(host, configuration);
        return transition;
    }

    private Optional<MitigationAction> whileNormal(HostState host, boolean overThreshold,
            DetectorConfiguration configuration) {
        if (!overThreshold) {
            return Optional.empty();
        }
        int flags = host.flag();
        LOG.debug("Host {} flagged ({}/{})", host.hostId(), flags, configuration.getFlagsBeforeActivation());
        if (flags >= configuration.getFlagsBeforeActivation()) {
            host.startMitigating();
            return Optional.of(MitigationAction.START);
        }
        return Optional.empty();
    }

    private Optional<MitigationAction> whileMitigating(HostState host, boolean overThreshold,
            DetectorConfiguration configuration) {
        if (overThreshold) {
            host.resetDeflags();
            return Optional.empty();
        }
        int deflags = host.deflag();
        LOG.debug("Host {} deflagged ({}/{})", host.hostId(), deflags,
                configuration.getDeflagsBeforeDeactivation());
        if (deflags >= configuration.getDeflagsBeforeDeactivation()) {
            host.stopMitigating();
            return Optional.of(MitigationAction.STOP);
        }
        return Optional.empty();
    }

    private void updateInclusion(HostState host, DetectorConfiguration configuration) {
        if (!host.isIncluded() && host.consecutiveActive() >= configuration.inclusionRunLength()) {
            host.include();
            LOG.info("Host {} included after {} active sample(s)", host.hostId(), host.consecutiveActive());
        } else if (host.isIncluded() && host.consecutiveInactive() >= configuration.exclusionRunLength()) {
            host.exclude();
            if (host.isMitigating()) {
                LOG.info("Host {} excluded after {} inactive sample(s); mitigation stays active",
                        host.hostId(), host.consecutiveInactive());
            } else {
                LOG.info("Host {} excluded after {} inactive sample(s)", host.hostId(), host.consecutiveInactive());
            }
        }
    }
}
