package com.toolflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * An ordered progress record inside a {@link Task}.
 * Steps are appended only; a step is never removed or reordered.
 *
 * Invariants:
 * - status follows {@link TaskStatus#canTransitionTo}
 * - result set only when status == COMPLETED
 * - error set only when status == FAILED or CANCELLED
 */
public record Step(
    String id,
    String description,
    TaskStatus status,
    JsonNode meta,
    JsonNode result,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt
) {
    public Step {
        meta = meta == null || meta.isNull() ? JsonNodeFactory.instance.objectNode() : meta.deepCopy();
        result = result == null || result.isNull() ? null : result.deepCopy();
    }

    @Override
    public JsonNode meta() {
        return meta.deepCopy();
    }

    @Override
    public JsonNode result() {
        return result != null ? result.deepCopy() : null;
    }

    /**
     * Create a new step in PENDING state.
     */
    public static Step create(String description, JsonNode meta) {
        return new Step(
            UUID.randomUUID().toString(),
            description != null ? description : "step",
            TaskStatus.PENDING,
            meta,
            null,
            null,
            Instant.now(),
            null,
            null
        );
    }

    public Step withStarted() {
        status.checkTransition(TaskStatus.RUNNING, "Step");
        return new Step(id, description, TaskStatus.RUNNING, meta, result, error,
            createdAt, Instant.now(), finishedAt);
    }

    public Step withCompleted(JsonNode stepResult) {
        status.checkTransition(TaskStatus.COMPLETED, "Step");
        return new Step(id, description, TaskStatus.COMPLETED, meta, stepResult, null,
            createdAt, startedAt, Instant.now());
    }

    public Step withFailed(String stepError) {
        status.checkTransition(TaskStatus.FAILED, "Step");
        return new Step(id, description, TaskStatus.FAILED, meta, null, stepError,
            createdAt, startedAt, Instant.now());
    }

    public Step withCancelled(String reason) {
        status.checkTransition(TaskStatus.CANCELLED, "Step");
        return new Step(id, description, TaskStatus.CANCELLED, meta, null, reason,
            createdAt, startedAt, Instant.now());
    }
}
