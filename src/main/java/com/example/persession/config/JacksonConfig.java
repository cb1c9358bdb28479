package com.example.persession.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Builds the {@link ObjectMapper} used for cache files.
 *
 * Cache files must stay readable across application versions, so this mapper is
 * kept separate from whatever mapper the host application configures.
 */
public final class JacksonConfig {

    private JacksonConfig() {
    }

    public static ObjectMapper cacheObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        // Instant and Duration fields of the snapshot
        objectMapper.registerModule(new JavaTimeModule());
        // ISO-8601 text instead of numeric timestamps
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        return objectMapper;
    }
}
