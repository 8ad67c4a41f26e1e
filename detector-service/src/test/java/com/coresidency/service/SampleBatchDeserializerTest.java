package com.coresidency.service;

import com.coresidency.core.model.SampleBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SampleBatchDeserializerTest {

    private final SampleBatchDeserializer deserializer = new SampleBatchDeserializer();

    @Test
    @DisplayName("Valid line becomes a batch with hosts in input order")
    void shouldDecodeBatch() {
        Optional<SampleBatch> batch = deserializer.deserialize(
                "{\"b\":{\"Activity\":1,\"NrConnections\":4},\"a\":{\"Activity\":0,\"NrConnections\":2.5}}");

        assertThat(batch).isPresent();
        assertThat(batch.get().hostIds()).containsExactly("b", "a");
        assertThat(batch.get().samples().get("a").get("NrConnections").doubleValue()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Malformed JSON, blank lines and invalid batches are dropped")
    void shouldDropBadInput() {
        assertThat(deserializer.deserialize("{not json")).isEmpty();
        assertThat(deserializer.deserialize("")).isEmpty();
        assertThat(deserializer.deserialize(null)).isEmpty();
        assertThat(deserializer.deserialize("null")).isEmpty();
        assertThat(deserializer.deserialize("[1,2]")).isEmpty();
        assertThat(deserializer.deserialize("{\"a\":{\"NrConnections\":1}}")).isEmpty();
        assertThat(deserializer.deserialize("{\"a\":{\"Activity\":1,\"NrConnections\":\"many\"}}")).isEmpty();
    }
}
