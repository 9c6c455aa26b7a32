package com.toolflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Short summary of a tool call kept for later recall.
 * The outcome is the tool result, or {@code {"error": message}} for a failed call.
 */
public record ToolTranscript(
    String runId,
    String toolName,
    JsonNode args,
    JsonNode outcome,
    Instant timestamp
) {
}
