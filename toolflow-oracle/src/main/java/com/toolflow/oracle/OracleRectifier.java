package com.toolflow.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Rectifier that asks a reasoning oracle for corrected arguments.
 *
 * <p>The oracle answers {@code {"args": {...}}} with a replacement, or
 * {@code {"rejected": true}} to give up. Anything else, including an oracle
 * failure, counts as no proposal. One question per rejection; no internal retry.</p>
 */
public class OracleRectifier implements Rectifier {

    private static final Logger log = LoggerFactory.getLogger(OracleRectifier.class);

    private final ReasoningOracle oracle;
    private final ObjectMapper objectMapper;

    public OracleRectifier(ReasoningOracle oracle, ObjectMapper objectMapper) {
        this.oracle = oracle;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<JsonNode> propose(String toolName, JsonNode args, JsonNode context, String reason) {
        if (oracle == null) {
            return Optional.empty();
        }

        String answer;
        try {
            answer = oracle.ask(OracleMode.RECTIFY, OraclePrompts.rectify(toolName, args, context, reason), context);
        } catch (OracleUnavailableException | RuntimeException e) {
            log.warn("Rectifier oracle failed for {}: {}", toolName, e.getMessage());
            return Optional.empty();
        }

        Optional<JsonNode> parsed = OracleResponses.parseObject(objectMapper, answer);
        if (parsed.isEmpty()) {
            log.warn("Rectifier oracle returned unparsable answer for {}", toolName);
            return Optional.empty();
        }
        if (parsed.get().path("rejected").asBoolean(false)) {
            log.info("Rectifier oracle declined to fix {}", toolName);
            return Optional.empty();
        }

        JsonNode corrected = parsed.get().get("args");
        if (corrected == null || !corrected.isObject()) {
            return Optional.empty();
        }
        log.info("Rectifier proposed replacement args for {}", toolName);
        return Optional.of(corrected);
    }
}
