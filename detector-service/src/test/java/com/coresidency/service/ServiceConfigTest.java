package com.coresidency.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceConfigTest {

    @Test
    @DisplayName("Defaults apply when the environment is empty")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of());

        assertThat(config.getConfigPath()).isEqualTo("configuration.json");
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.isHealthEnabled()).isTrue();
    }

    @Test
    @DisplayName("Environment variables override defaults; blank values are ignored")
    void shouldReadEnvironment() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of(
                ServiceConfig.ENV_CONFIG_PATH, "/etc/coresidency/config.yml",
                ServiceConfig.ENV_HEALTH_PORT, "9090",
                ServiceConfig.ENV_HEALTH_ENABLED, " "));

        assertThat(config.getConfigPath()).isEqualTo("/etc/coresidency/config.yml");
        assertThat(config.getHealthPort()).isEqualTo(9090);
        assertThat(config.isHealthEnabled()).isTrue();
        assertThat(config.toString()).contains("9090");
    }

    @Test
    @DisplayName("Unparseable port is reported as IllegalStateException")
    void shouldRejectNonNumericPort() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of(ServiceConfig.ENV_HEALTH_PORT, "eighty")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Builder validates port range and config path")
    void shouldValidate() {
        assertThatThrownBy(() -> ServiceConfig.builder().healthPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> ServiceConfig.builder().configPath("  ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ServiceConfig.builder().healthEnabled(false).build().isHealthEnabled()).isFalse();
    }
}
