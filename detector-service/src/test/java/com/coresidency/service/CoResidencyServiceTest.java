package com.coresidency.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoResidencyServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path configFile;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("configuration.json");
        try (InputStream in = getClass().getResourceAsStream("/configuration.json")) {
            Files.copy(in, configFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Test
    @DisplayName("JSON sample lines in, JSON decision lines out")
    void shouldRoundTripSamplesToDecisions() throws Exception {
        String input;
        try (InputStream in = getClass().getResourceAsStream("/samples.ndjson")) {
            input = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        StringWriter output = new StringWriter();

        CoResidencyService service = new CoResidencyService(config(), CLOCK);
        service.start(new StringReader(input), output);
        service.awaitInput();
        Map<String, Object> status = service.status();
        service.stop();

        List<JsonNode> decisions = new ArrayList<>();
        ObjectMapper mapper = new ObjectMapper();
        for (String line : output.toString().split("\\R")) {
            if (!line.isBlank()) {
                decisions.add(mapper.readTree(line));
            }
        }

        assertThat(decisions).hasSize(2);
        assertThat(decisions.get(0).get("hostId").asText()).isEqualTo("1");
        assertThat(decisions.get(0).get("action").asText()).isEqualTo("START");
        assertThat(decisions.get(0).get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(decisions.get(0).get("configurationVersion").asText()).isEqualTo("service-test");
        assertThat(decisions.get(1).get("hostId").asText()).isEqualTo("1");
        assertThat(decisions.get(1).get("action").asText()).isEqualTo("STOP");

        assertThat(status)
                .containsEntry("processedBatches", 6L)
                .containsEntry("rejectedLines", 2L)
                .containsEntry("trackedHosts", 4)
                .containsEntry("configurationVersion", "service-test");
    }

    @Test
    @DisplayName("A failure while processing one line does not stop the worker")
    void shouldKeepReadingAfterProcessingFailure() throws Exception {
        String input;
        try (InputStream in = getClass().getResourceAsStream("/samples.ndjson")) {
            input = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        StringWriter output = new StringWriter();

        CoResidencyService service = new CoResidencyService(config(), CLOCK);
        service.getDetector().addDecisionListener(decision -> {
            throw new IllegalStateException("listener failure for host " + decision.getHostId());
        });
        service.start(new StringReader(input), output);
        service.awaitInput();
        Map<String, Object> status = service.status();
        service.stop();

        assertThat(output.toString().lines().filter(line -> !line.isBlank())).hasSize(2);
        assertThat(status)
                .containsEntry("processedBatches", 4L)
                .containsEntry("rejectedLines", 4L);
    }

    @Test
    @DisplayName("Nothing is written after stop and stop is idempotent")
    void shouldNotWriteAfterStop() throws Exception {
        StringWriter output = new StringWriter();
        CoResidencyService service = new CoResidencyService(config(), CLOCK);
        service.start(new StringReader(""), output);
        service.awaitInput();

        service.stop();
        service.stop();
        service.process(line(5, 5, 5, 5));
        service.process(line(9, 5, 5, 5));

        assertThat(output.toString()).isEmpty();
        assertThat(service.getDetector().isStopped()).isTrue();
        assertThat(service.getConfigurationManager().isRunning()).isFalse();
        assertThatThrownBy(() -> service.start(new StringReader(""), output))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A missing configuration file fails at construction")
    void shouldFailFastOnMissingConfiguration() {
        ServiceConfig missing = ServiceConfig.builder()
                .configPath(tempDir.resolve("absent.json").toString())
                .healthEnabled(false)
                .build();

        assertThatThrownBy(() -> new CoResidencyService(missing, CLOCK))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Editing the configuration file reaches the running detector")
    void shouldApplyConfigurationReload() throws Exception {
        CoResidencyService service = new CoResidencyService(config(), CLOCK);
        service.start(new StringReader(""), new StringWriter());
        try {
            String edited = Files.readString(configFile).replace("\"service-test\"", "\"service-test-2\"");
            Files.writeString(configFile, edited);
            assertThat(service.getConfigurationManager().reload()).isTrue();

            assertThat(service.getDetector().activeConfiguration().getVersion()).isEqualTo("service-test-2");
        } finally {
            service.stop();
        }
    }

    private ServiceConfig config() {
        return ServiceConfig.builder()
                .configPath(configFile.toString())
                .healthEnabled(false)
                .build();
    }

    private static String line(int... connections) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < connections.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('"').append(i + 1).append("\":{\"Activity\":1,\"NrConnections\":")
                    .append(connections[i]).append(",\"NrPackets\":0,\"PacketSize\":0}");
        }
        return sb.append('}').toString();
    }
}
