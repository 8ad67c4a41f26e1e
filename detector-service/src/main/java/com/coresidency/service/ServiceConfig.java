package com.coresidency.service;

import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the co-residency detector service.
 *
 * <p>
 * Values are resolved from environment variables with defaults:
 * </p>
 * <ul>
 * <li>{@code CORESIDENCY_CONFIG_PATH} – detector configuration file
 * (default {@code configuration.json})</li>
 * <li>{@code HEALTH_PORT} – port of the health/status endpoint (default
 * {@code 8080})</li>
 * <li>{@code HEALTH_ENABLED} – whether to start the endpoint at all (default
 * {@code true})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    public static final String ENV_CONFIG_PATH = "CORESIDENCY_CONFIG_PATH";
    public static final String ENV_HEALTH_PORT = "HEALTH_PORT";
    public static final String ENV_HEALTH_ENABLED = "HEALTH_ENABLED";

    private final String configPath;
    private final int healthPort;
    private final boolean healthEnabled;

    private ServiceConfig(Builder b) {
        this.configPath = b.configPath;
        this.healthPort = b.healthPort;
        this.healthEnabled = b.healthEnabled;
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ServiceConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .configPath(env(env, ENV_CONFIG_PATH, "configuration.json"))
                    .healthPort(Integer.parseInt(env(env, ENV_HEALTH_PORT, "8080")))
                    .healthEnabled(Boolean.parseBoolean(env(env, ENV_HEALTH_ENABLED, "true")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getConfigPath() {
        return configPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public boolean isHealthEnabled() {
        return healthEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}. {@link #build()} rejects a blank
     * configuration path and a port outside [1, 65535].
     */
    public static class Builder {
        private String configPath = "configuration.json";
        private int healthPort = 8080;
        private boolean healthEnabled = true;

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder healthEnabled(boolean v) {
            this.healthEnabled = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(configPath, "configPath required");
            if (configPath.isBlank()) {
                throw new IllegalArgumentException("configPath must not be blank");
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "configPath='" + configPath + '\'' +
                ", healthPort=" + healthPort +
                ", healthEnabled=" + healthEnabled +
                '}';
    }
}
