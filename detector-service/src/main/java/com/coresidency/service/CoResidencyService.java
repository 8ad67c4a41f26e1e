package com.coresidency.service;

import com.coresidency.core.config.ConfigurationManager;
import com.coresidency.core.config.DetectorConfiguration;
import com.coresidency.core.config.EventType;
import com.coresidency.core.detection.CoResidencyDetector;
import com.coresidency.core.detection.ConfigurationMismatchException;
import com.coresidency.core.event.EventBus;
import com.coresidency.core.event.SynchronousEventBus;
import com.coresidency.core.model.MitigationDecision;
import com.coresidency.core.model.SampleBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Main entry point of the co-residency detector service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   input (one JSON sample batch per line)
 *     → SampleBatchDeserializer → SampleBatch
 *     → event bus (SampleEvent) → CoResidencyDetector
 *     → MitigationDecision → DecisionSerializer
 *     → output (one JSON decision per line)
 * </pre>
 *
 * <p>
 * Batches are consumed on a single {@code detector-worker} thread. The
 * configuration file is watched by a {@link ConfigurationManager} and reloads
 * reach the detector through the same bus.
 * </p>
 *
 * @since 1.0.0
 */
public final class CoResidencyService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CoResidencyService.class);
    private static final long STOP_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);

    private final ServiceConfig config;
    private final EventBus eventBus;
    private final ConfigurationManager configurationManager;
    private final CoResidencyDetector detector;
    private final HealthServer healthServer;
    private final String sampleEventName;

    private final SampleBatchDeserializer deserializer = new SampleBatchDeserializer();
    private final DecisionSerializer serializer = new DecisionSerializer();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong processedBatches = new AtomicLong();
    private final AtomicLong rejectedLines = new AtomicLong();

    private Thread worker;
    private volatile BufferedWriter output;

    /**
     * @param config service configuration
     * @throws com.coresidency.core.config.MalformedConfigurationException if
     *         the detector configuration file is missing or invalid
     */
    public CoResidencyService(ServiceConfig config) {
        this(config, Clock.systemUTC());
    }

    CoResidencyService(ServiceConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "ServiceConfig must not be null");
        this.eventBus = new SynchronousEventBus();
        this.configurationManager = new ConfigurationManager(Paths.get(config.getConfigPath()), eventBus);

        DetectorConfiguration initial = configurationManager.current();
        this.sampleEventName = initial.wireName(EventType.SAMPLE_EVENT);
        this.detector = CoResidencyDetector.attach(initial, eventBus, clock);
        this.detector.addDecisionListener(this::writeDecision);
        this.healthServer = new HealthServer(this::status);
    }

    public static void main(String[] args) throws InterruptedException {
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting co-residency detector with config: {}", config);

        CoResidencyService service = new CoResidencyService(config);
        Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "detector-shutdown"));

        service.start(new InputStreamReader(System.in, StandardCharsets.UTF_8),
                new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        service.awaitInput();
        service.stop();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start watching the configuration, the health server (if enabled) and the
     * worker that consumes {@code input}.
     *
     * @param input  newline-delimited JSON sample batches
     * @param output receives one JSON line per mitigation decision
     * @throws IllegalStateException if the service was already started
     */
    public void start(Reader input, Writer output) {
        Objects.requireNonNull(input, "Input must not be null");
        Objects.requireNonNull(output, "Output must not be null");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Service already started");
        }
        this.output = new BufferedWriter(output);

        configurationManager.start();
        if (config.isHealthEnabled()) {
            healthServer.start(config.getHealthPort());
        }

        BufferedReader reader = new BufferedReader(input);
        worker = new Thread(() -> consume(reader), "detector-worker");
        worker.setDaemon(true);
        worker.start();
        LOG.info("Co-residency detector service started");
    }

    /**
     * Block until the input is exhausted or the service is stopped.
     */
    public void awaitInput() throws InterruptedException {
        Thread thread = worker;
        if (thread != null) {
            thread.join();
        }
    }

    /**
     * Stop the detector first, so that no decision is written afterwards, then
     * the configuration watcher, the health server and the worker. Calling this
     * more than once has no effect.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        detector.stop();
        configurationManager.stop();
        healthServer.stop();

        Thread thread = worker;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(STOP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                LOG.warn("Worker still blocked on input after {} ms", STOP_TIMEOUT_MS);
            }
        }
        LOG.info("Co-residency detector service stopped after {} batch(es), {} rejected line(s)",
                processedBatches.get(), rejectedLines.get());
    }

    @Override
    public void close() {
        stop();
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    private void consume(BufferedReader reader) {
        try {
            String line;
            while (!stopped.get() && (line = reader.readLine()) != null) {
                process(line);
            }
        } catch (IOException e) {
            if (!stopped.get()) {
                LOG.error("Failed to read sample input: {}", e.getMessage(), e);
            }
        }
        LOG.info("Sample input closed");
    }

    /**
     * Decode one input line and deliver it to the detector.
     *
     * @param line one JSON sample batch
     */
    void process(String line) {
        Optional<SampleBatch> batch = deserializer.deserialize(line);
        if (batch.isEmpty()) {
            if (!line.isBlank()) {
                rejectedLines.incrementAndGet();
            }
            return;
        }
        try {
            eventBus.emit(sampleEventName, batch.get());
            processedBatches.incrementAndGet();
        } catch (ConfigurationMismatchException e) {
            rejectedLines.incrementAndGet();
            LOG.warn("Dropping batch: {}", e.getMessage());
        } catch (RuntimeException e) {
            rejectedLines.incrementAndGet();
            LOG.error("Failed to process batch, continuing with the next line: {}", e.getMessage(), e);
        }
    }

    private void writeDecision(MitigationDecision decision) {
        Optional<String> json = serializer.serialize(decision);
        if (json.isEmpty() || output == null) {
            return;
        }
        synchronized (this) {
            try {
                output.write(json.get());
                output.newLine();
                output.flush();
            } catch (IOException e) {
                LOG.error("Failed to write decision for host {}: {}", decision.getHostId(), e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------

    Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", stopped.get() ? "STOPPED" : "UP");
        status.put("configurationVersion", detector.activeConfiguration().getVersion());
        status.put("trackedHosts", detector.hostSnapshots().size());
        status.put("mitigatingHosts", detector.mitigatingHosts());
        status.put("processedBatches", processedBatches.get());
        status.put("rejectedLines", rejectedLines.get());
        return status;
    }

    public CoResidencyDetector getDetector() {
        return detector;
    }

    public ConfigurationManager getConfigurationManager() {
        return configurationManager;
    }

    int getHealthPort() {
        return healthServer.getPort();
    }
}
