package com.toolflow.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Extracts the JSON object from a free-text oracle answer.
 */
final class OracleResponses {

    private OracleResponses() {
    }

    /**
     * Parse the answer as JSON, falling back to the outermost {@code {...}} span
     * when the oracle wrapped its JSON in prose or a code fence.
     */
    static Optional<JsonNode> parseObject(ObjectMapper objectMapper, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> whole = tryParse(objectMapper, text.trim());
        if (whole.isPresent()) {
            return whole;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return tryParse(objectMapper, text.substring(start, end + 1));
    }

    private static Optional<JsonNode> tryParse(ObjectMapper objectMapper, String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
