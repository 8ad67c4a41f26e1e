package com.coresidency.core.detection;

import com.coresidency.core.config.DetectorConfiguration;
import com.coresidency.core.config.EventType;
import com.coresidency.core.event.EventBus;
import com.coresidency.core.model.HostSnapshot;
import com.coresidency.core.model.HostState;
import com.coresidency.core.model.InvalidSampleBatchException;
import com.coresidency.core.model.MetricValue;
import com.coresidency.core.model.MitigationAction;
import com.coresidency.core.model.MitigationDecision;
import com.coresidency.core.model.SampleBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Orchestrates co-residency detection for a population of hosts.
 *
 * <h3>Per batch</h3>
 * <ol>
 * <li>Read the active configuration once.</li>
 * <li>Reject the batch if a metric has no threshold while mitigation is
 * enabled ({@link ConfigurationMismatchException}).</li>
 * <li>Create unknown hosts, push each sample into its host's window and
 * update the activity run-lengths.</li>
 * <li>Compute population averages over the currently included hosts that are
 * not under mitigation.</li>
 * <li>Compare every included host and advance its hysteresis state.</li>
 * <li>Emit one {@code StartMitigation}/{@code StopMitigation} event per
 * transition, payload the host ID.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Batches are processed one at a time under a lock. A configuration reload is
 * a single atomic reference swap that does not wait for the lock; a batch that
 * already started finishes against the snapshot it read.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Hosts are kept in first-seen order, so replaying the same batches against a
 * fresh detector yields the same events in the same order.
 * </p>
 *
 * @since 1.0.0
 */
public class CoResidencyDetector implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CoResidencyDetector.class);

    private final EventBus eventBus;
    private final Clock clock;
    private final StatisticsEngine statisticsEngine;
    private final DeviationEvaluator deviationEvaluator;
    private final HysteresisEngine hysteresisEngine;

    private final AtomicReference<DetectorConfiguration> configuration;
    private final ReentrantLock processingLock = new ReentrantLock();
    private final Map<String, HostState> hosts = new LinkedHashMap<>();
    private final List<Consumer<MitigationDecision>> decisionListeners = new CopyOnWriteArrayList<>();
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    private volatile PopulationStatistics lastStatistics = PopulationStatistics.empty();
    private volatile boolean stopped;

    /**
     * Create a detector without subscribing it to the event bus. Batches and
     * reloads are then delivered by calling {@link #onSampleBatch(SampleBatch)}
     * and {@link #onConfigurationReloaded(DetectorConfiguration)} directly.
     *
     * @param initial  initial configuration
     * @param eventBus bus on which mitigation events are emitted
     * @param clock    time source for decision timestamps
     */
    public CoResidencyDetector(DetectorConfiguration initial, EventBus eventBus, Clock clock) {
        this.configuration = new AtomicReference<>(
                Objects.requireNonNull(initial, "Initial configuration must not be null"));
        this.eventBus = Objects.requireNonNull(eventBus, "EventBus must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.statisticsEngine = new StatisticsEngine();
        this.deviationEvaluator = new DeviationEvaluator(statisticsEngine);
        this.hysteresisEngine = new HysteresisEngine();
    }

    /**
     * Create a detector subscribed to the {@code SampleEvent} and
     * {@code ConfigurationReloaded} events of {@code eventBus}, using the wire
     * names of the initial configuration.
     *
     * @param initial  initial configuration
     * @param eventBus bus to subscribe to and emit on
     * @return a subscribed detector
     */
    public static CoResidencyDetector attach(DetectorConfiguration initial, EventBus eventBus) {
        return attach(initial, eventBus, Clock.systemUTC());
    }

    /**
     * @param initial  initial configuration
     * @param eventBus bus to subscribe to and emit on
     * @param clock    time source for decision timestamps
     * @return a subscribed detector
     * @see #attach(DetectorConfiguration, EventBus)
     */
    public static CoResidencyDetector attach(DetectorConfiguration initial, EventBus eventBus, Clock clock) {
        CoResidencyDetector detector = new CoResidencyDetector(initial, eventBus, clock);
        detector.subscribe();
        LOG.info("Initialized co-residency detector with configuration version {}", initial.getVersion());
        return detector;
    }

    private void subscribe() {
        DetectorConfiguration initial = configuration.get();
        subscriptions.add(eventBus.subscribe(initial.wireName(EventType.SAMPLE_EVENT),
                Object.class, this::onSampleEvent));
        subscriptions.add(eventBus.subscribe(initial.wireName(EventType.CONFIGURATION_RELOADED),
                DetectorConfiguration.class, this::onConfigurationReloaded));
    }

    // ---------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------

    /**
     * Process one round of samples.
     *
     * @param batch validated sample batch; must not be {@code null}
     * @throws ConfigurationMismatchException if a reported metric has no
     *                                        threshold while mitigation is
     *                                        enabled; no host state is changed
     */
    public void onSampleBatch(SampleBatch batch) {
        Objects.requireNonNull(batch, "Sample batch must not be null");
        if (stopped) {
            LOG.debug("Detector stopped, ignoring batch of {} host(s)", batch.size());
            return;
        }

        processingLock.lock();
        try {
            if (stopped) {
                return;
            }
            process(batch, configuration.get());
        } finally {
            processingLock.unlock();
        }
    }

    /**
     * Swap in a new configuration for subsequent batches.
     *
     * @param next new configuration; must not be {@code null}
     */
    public void onConfigurationReloaded(DetectorConfiguration next) {
        Objects.requireNonNull(next, "Configuration must not be null");
        if (stopped) {
            return;
        }
        DetectorConfiguration previous = configuration.getAndSet(next);
        LOG.info("Reloading configuration in response to ConfigurationReloaded: version {} -> {}",
                previous.getVersion(), next.getVersion());
    }

    private void onSampleEvent(Object payload) {
        if (payload instanceof SampleBatch batch) {
            onSampleBatch(batch);
        } else if (payload instanceof Map<?, ?> raw) {
            onSampleBatch(SampleBatch.fromRaw(raw));
        } else {
            throw new InvalidSampleBatchException("Unsupported sample payload: "
                    + (payload == null ? "null" : payload.getClass().getName()));
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    private void process(SampleBatch batch, DetectorConfiguration config) {
        requireThresholds(batch, config);
        if (batch.isEmpty()) {
            LOG.debug("Empty sample batch, nothing to do");
            return;
        }

        for (HostState host : hosts.values()) {
            if (host.capacity() != config.getMaxSamples()) {
                host.resize(config.getMaxSamples());
            }
        }
        batch.samples().forEach((hostId, sample) -> hosts
                .computeIfAbsent(hostId, id -> newHost(id, config))
                .record(sample));

        // Suspect hosts stay out of the baseline they are compared against.
        List<HostState> population = new ArrayList<>();
        for (HostState host : hosts.values()) {
            if (host.isIncluded() && !host.isMitigating()) {
                population.add(host);
            }
        }
        PopulationStatistics statistics = statisticsEngine.compute(population, config.isNormalizeSamples());
        lastStatistics = statistics;
        LOG.debug("Batch of {} host(s): {}", batch.size(), statistics);

        for (HostState host : hosts.values()) {
            DeviationVerdict verdict = host.isIncluded() && config.isMitigationEnabled()
                    ? deviationEvaluator.evaluate(host, statistics, config)
                    : null;
            Optional<MitigationAction> transition = hysteresisEngine.advance(host, verdict, config);
            transition.ifPresent(action -> publish(host.hostId(), action, verdict, config));
        }
    }

    private void requireThresholds(SampleBatch batch, DetectorConfiguration config) {
        if (!config.isMitigationEnabled() || batch.isEmpty()) {
            return;
        }
        for (String metric : batch.metricNames()) {
            if (!SampleBatch.ACTIVITY.equals(metric) && !config.hasThreshold(metric)) {
                String hostId = batch.hostIds().iterator().next();
                LOG.warn("Rejecting batch: metric '{}' reported by host {} has no threshold in configuration {}",
                        metric, hostId, config.getVersion());
                throw new ConfigurationMismatchException(metric, hostId);
            }
        }
    }

    private HostState newHost(String hostId, DetectorConfiguration config) {
        LOG.debug("First observation of host {}", hostId);
        return new HostState(hostId, config.getMaxSamples());
    }

    private void publish(String hostId, MitigationAction action, DeviationVerdict verdict,
            DetectorConfiguration config) {
        EventType event = action == MitigationAction.START
                ? EventType.START_MITIGATION
                : EventType.STOP_MITIGATION;
        if (action == MitigationAction.START) {
            LOG.info("Initiating mitigation on host {} (exceeded: {})", hostId, verdict.getExceededMetrics());
        } else {
            LOG.info("Stopping mitigation on host {}", hostId);
        }

        eventBus.emit(config.wireName(event), hostId);

        if (!decisionListeners.isEmpty()) {
            MitigationDecision decision = MitigationDecision.builder()
                    .hostId(hostId)
                    .action(action)
                    .timestamp(clock.instant())
                    .configurationVersion(config.getVersion())
                    .details(action == MitigationAction.START
                            ? "Deviation exceeded thresholds on " + verdict.getExceededMetrics()
                            : "Deviation back within thresholds")
                    .build();
            for (Consumer<MitigationDecision> listener : decisionListeners) {
                listener.accept(decision);
            }
        }
    }

    // ---------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------

    /**
     * Register a listener invoked once per transition, after the bus event.
     *
     * @param listener decision callback
     */
    public void addDecisionListener(Consumer<MitigationDecision> listener) {
        decisionListeners.add(Objects.requireNonNull(listener, "Listener must not be null"));
    }

    public DetectorConfiguration activeConfiguration() {
        return configuration.get();
    }

    /**
     * @param hostId host identifier
     * @return a snapshot of the host's state, or empty if the host is unknown
     */
    public Optional<HostSnapshot> hostSnapshot(String hostId) {
        processingLock.lock();
        try {
            HostState host = hosts.get(hostId);
            return host == null ? Optional.empty() : Optional.of(host.snapshot());
        } finally {
            processingLock.unlock();
        }
    }

    /**
     * @return snapshots of all known hosts, in first-seen order
     */
    public List<HostSnapshot> hostSnapshots() {
        processingLock.lock();
        try {
            List<HostSnapshot> snapshots = new ArrayList<>(hosts.size());
            hosts.values().forEach(host -> snapshots.add(host.snapshot()));
            return Collections.unmodifiableList(snapshots);
        } finally {
            processingLock.unlock();
        }
    }

    /**
     * @return IDs of the hosts currently under mitigation
     */
    public Set<String> mitigatingHosts() {
        processingLock.lock();
        try {
            Set<String> mitigating = new LinkedHashSet<>();
            hosts.values().stream()
                    .filter(HostState::isMitigating)
                    .forEach(host -> mitigating.add(host.hostId()));
            return Collections.unmodifiableSet(mitigating);
        } finally {
            processingLock.unlock();
        }
    }

    /**
     * @return population averages computed by the most recent batch
     */
    public Map<String, MetricValue> lastPopulationAverages() {
        return lastStatistics.getAverages();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Unsubscribe from the bus and wait for an in-flight batch to finish. No
     * events are emitted afterwards.
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        subscriptions.forEach(EventBus.Subscription::cancel);
        // Waits for a batch that is already past the stopped check.
        processingLock.lock();
        processingLock.unlock();
        LOG.info("Co-residency detector stopped");
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public void close() {
        stop();
    }
}
