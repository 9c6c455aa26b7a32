package com.toolflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * Text column codec shared by the JDBC repositories.
 */
final class JsonColumns {

    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    // Fixed-width so that text ordering matches time ordering.
    private static final DateTimeFormatter INSTANT_COLUMN = new DateTimeFormatterBuilder()
        .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
        .appendFraction(ChronoField.NANO_OF_SECOND, 9, 9, true)
        .appendLiteral('Z')
        .toFormatter()
        .withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize column value: " + e.getOriginalMessage(), e);
        }
    }

    JsonNode readNode(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize JSON column: {}", e.getOriginalMessage());
            return null;
        }
    }

    <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize JSON column: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    static String instant(Instant instant) {
        return instant != null ? INSTANT_COLUMN.format(instant) : null;
    }

    static Instant instant(String text) {
        return text != null ? Instant.parse(text) : null;
    }
}
