package com.coresidency.core.config;

import com.coresidency.core.event.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the active {@link DetectorConfiguration}.
 *
 * <p>
 * Loads the configuration file on construction (failing fast if it is
 * invalid), then, once {@link #start()} is called, watches the file's
 * directory on a daemon thread. Whenever the file changes it is parsed again;
 * a valid result replaces the active configuration atomically and is published
 * on the event bus under the {@code ConfigurationReloaded} wire name.
 * </p>
 *
 * <h3>Failed reloads</h3>
 * <p>
 * A file that fails to parse or validate leaves the previous configuration
 * active. The failure is logged and retained in {@link #lastReloadFailure()};
 * no event is published.
 * </p>
 *
 * <h3>Event names</h3>
 * <p>
 * The reload event is published under the wire name of the configuration being
 * <em>replaced</em>, which is the name existing subscribers registered with.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationManager.class);

    private final Path configPath;
    private final EventBus eventBus;
    private final AtomicReference<DetectorConfiguration> current = new AtomicReference<>();
    private final AtomicReference<MalformedConfigurationException> lastFailure = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private WatchService watchService;
    private Thread watcher;

    /**
     * @param configPath configuration file; relative paths are resolved against
     *                   the working directory
     * @param eventBus   bus on which reloads are published
     * @throws MalformedConfigurationException if the initial configuration is
     *                                         invalid
     */
    public ConfigurationManager(Path configPath, EventBus eventBus) {
        this.configPath = Objects.requireNonNull(configPath, "Configuration path must not be null")
                .toAbsolutePath().normalize();
        this.eventBus = Objects.requireNonNull(eventBus, "EventBus must not be null");
        this.current.set(ConfigurationParser.fromFile(this.configPath));
        LOG.info("Configuration manager initialised from {}", this.configPath);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * @return the active configuration; never {@code null}
     */
    public DetectorConfiguration current() {
        return current.get();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * @return the failure of the most recent unsuccessful reload, cleared by the
     *         next successful one
     */
    public Optional<MalformedConfigurationException> lastReloadFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    /**
     * Start watching the configuration file. Calling this twice has no effect.
     *
     * @throws IllegalStateException if the watch service cannot be created
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Path directory = configPath.getParent();
        try {
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            running.set(false);
            throw new IllegalStateException("Failed to watch configuration directory: " + directory, e);
        }

        watcher = new Thread(this::watchLoop, "config-watcher");
        watcher.setDaemon(true);
        watcher.start();
        LOG.info("Watching {} for configuration changes", configPath);
    }

    /**
     * Parse the configuration file again and, if valid, swap it in and publish
     * the reload event.
     *
     * @return {@code true} if the configuration was replaced
     */
    public synchronized boolean reload() {
        DetectorConfiguration next;
        try {
            next = ConfigurationParser.fromFile(configPath);
        } catch (MalformedConfigurationException e) {
            lastFailure.set(e);
            LOG.error("Rejected configuration reload from {}, keeping version {}: {}",
                    configPath, current.get().getVersion(), e.getMessage());
            return false;
        }

        lastFailure.set(null);
        DetectorConfiguration previous = current.getAndSet(next);
        LOG.info("Configuration reloaded: version {} -> {}", previous.getVersion(), next.getVersion());
        warnOnRenamedSubscriptions(previous, next);

        eventBus.emit(previous.wireName(EventType.CONFIGURATION_RELOADED), next);
        return true;
    }

    /**
     * Stop watching and join the watcher thread.
     */
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            thread = watcher;
            try {
                watchService.close();
            } catch (IOException e) {
                LOG.warn("Failed to close configuration watch service: {}", e.getMessage(), e);
            }
        }
        // A reload subscriber may stop the manager on the watcher thread itself.
        if (thread != Thread.currentThread()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Configuration watcher stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void watchLoop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    changed = true;
                } else if (configPath.getFileName().equals(event.context())) {
                    changed = true;
                }
            }
            key.reset();

            if (changed && running.get()) {
                LOG.info("Configuration file changed. Reloading...");
                try {
                    reload();
                } catch (RuntimeException e) {
                    LOG.error("Configuration reload subscriber failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    private static void warnOnRenamedSubscriptions(DetectorConfiguration previous, DetectorConfiguration next) {
        for (EventType type : new EventType[] { EventType.SAMPLE_EVENT, EventType.CONFIGURATION_RELOADED }) {
            if (!previous.wireName(type).equals(next.wireName(type))) {
                LOG.warn("Wire name of {} changed from '{}' to '{}'; existing subscriptions keep the old name",
                        type.logicalName(), previous.wireName(type), next.wireName(type));
            }
        }
    }
}
