package com.coresidency.service;

import com.coresidency.core.model.MitigationDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts a {@link MitigationDecision} to a single JSON line with an ISO-8601
 * timestamp.
 */
public class DecisionSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionSerializer.class);

    private final ObjectMapper mapper;

    public DecisionSerializer() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public Optional<String> serialize(MitigationDecision decision) {
        try {
            return Optional.of(mapper.writeValueAsString(decision));
        } catch (Exception e) {
            LOG.error("Failed to serialize decision for host {}: {}", decision.getHostId(), e.getMessage(), e);
            return Optional.empty();
        }
    }
}
