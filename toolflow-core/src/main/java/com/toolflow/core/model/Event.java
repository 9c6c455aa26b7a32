package com.toolflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a state change.
 * Append-only; events are never deleted or modified.
 *
 * Invariants:
 * - sequence increases with emission order
 */
public record Event(
    UUID id,
    long sequence,
    String name,
    JsonNode payload,
    Instant timestamp
) {
    public static Event create(long sequence, String name, JsonNode payload) {
        return new Event(UUID.randomUUID(), sequence, name, payload, Instant.now());
    }

    public boolean isTaskEvent() {
        return name.startsWith("task.");
    }

    public boolean isToolEvent() {
        return name.startsWith("tool.");
    }

    public boolean isWorkflowEvent() {
        return name.startsWith("workflow.");
    }
}
