package com.coresidency.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server exposing health, readiness and detector status.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} – same; readiness probe target</li>
 * <li>{@code GET /status} – JSON object produced by the status supplier</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<Map<String, Object>> status;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    /**
     * @param status supplier of the {@code /status} body, called per request
     */
    public HealthServer(Supplier<Map<String, Object>> status) {
        this.status = Objects.requireNonNull(status, "Status supplier must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} binds an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", HealthServer::handleHealthCheck);
            server.createContext("/readiness", HealthServer::handleHealthCheck);
            server.createContext("/status", this::handleStatus);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if the server is not running
     */
    public int getPort() {
        return running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        byte[] body;
        int code = 200;
        try {
            body = mapper.writeValueAsBytes(status.get());
        } catch (RuntimeException e) {
            LOG.warn("Failed to build status response: {}", e.getMessage(), e);
            body = "{\"status\":\"ERROR\"}".getBytes(StandardCharsets.UTF_8);
            code = 500;
        }
        respond(exchange, code, body);
    }

    private static void respond(HttpExchange exchange, int code, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
