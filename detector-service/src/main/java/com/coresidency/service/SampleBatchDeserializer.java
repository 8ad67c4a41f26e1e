package com.coresidency.service;

import com.coresidency.core.model.InvalidSampleBatchException;
import com.coresidency.core.model.SampleBatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes one JSON line into a {@link SampleBatch}.
 *
 * <p>
 * Expected shape: {@code {"<hostId>": {"Activity": 1, "<metric>": <number>, ...}, ...}}.
 * Host order in the line is kept. Malformed lines are logged and dropped
 * (returns {@link Optional#empty()}), so one bad line does not stop the input.
 * </p>
 */
public class SampleBatchDeserializer {

    private static final Logger LOG = LoggerFactory.getLogger(SampleBatchDeserializer.class);
    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, Object>>> BATCH_TYPE =
            new TypeReference<>() {
            };

    private final ObjectMapper mapper = new ObjectMapper();

    public Optional<SampleBatch> deserialize(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        try {
            Map<String, LinkedHashMap<String, Object>> raw = mapper.readValue(line, BATCH_TYPE);
            if (raw == null) {
                LOG.warn("Skipping sample line: expected a JSON object, got null");
                return Optional.empty();
            }
            return Optional.of(SampleBatch.of(raw));
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to parse sample line – skipping: {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (InvalidSampleBatchException e) {
            LOG.warn("Invalid sample batch – skipping: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
