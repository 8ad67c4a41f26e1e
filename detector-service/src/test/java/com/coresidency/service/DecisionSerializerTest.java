package com.coresidency.service;

import com.coresidency.core.model.MitigationAction;
import com.coresidency.core.model.MitigationDecision;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionSerializerTest {

    @Test
    @DisplayName("Decision is written as one JSON line with an ISO-8601 timestamp")
    void shouldSerializeDecision() throws Exception {
        MitigationDecision decision = MitigationDecision.builder()
                .hostId("42")
                .action(MitigationAction.START)
                .timestamp(Instant.parse("2024-03-01T12:00:00Z"))
                .configurationVersion("1.0")
                .details("Deviation exceeded thresholds on [NrConnections]")
                .build();

        String json = new DecisionSerializer().serialize(decision).orElseThrow();

        assertThat(json).doesNotContain("\n");
        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.get("hostId").asText()).isEqualTo("42");
        assertThat(node.get("action").asText()).isEqualTo("START");
        assertThat(node.get("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(node.get("configurationVersion").asText()).isEqualTo("1.0");
    }
}
