package com.toolflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A unit of work tracked through its lifecycle.
 * Every copy is immutable; state changes produce a new instance.
 *
 * Primary Key: id
 *
 * Invariants:
 * - status transitions: PENDING -> RUNNING -> {COMPLETED | FAILED}, any non-terminal -> CANCELLED
 * - steps are append-only and keep insertion order
 * - result set only when status == COMPLETED
 * - error set only when status == FAILED or CANCELLED
 */
public record Task(
    String id,
    String parent,
    String title,
    TaskStatus status,
    List<Step> steps,
    JsonNode meta,
    JsonNode result,
    String error,
    Instant createdAt,
    Instant updatedAt
) {
    public Task {
        steps = steps != null ? List.copyOf(steps) : List.of();
        meta = meta == null || meta.isNull() ? JsonNodeFactory.instance.objectNode() : meta.deepCopy();
        result = result == null || result.isNull() ? null : result.deepCopy();
    }

    /**
     * @return a copy; changing it does not change the task
     */
    @Override
    public JsonNode meta() {
        return meta.deepCopy();
    }

    /**
     * @return a copy, or null when no result is set
     */
    @Override
    public JsonNode result() {
        return result != null ? result.deepCopy() : null;
    }

    /**
     * Create a new task in PENDING state with a random id.
     */
    public static Task create(String title, String parent, JsonNode meta) {
        return create(UUID.randomUUID().toString(), title, parent, meta);
    }

    /**
     * Create a new task in PENDING state with a caller-chosen id.
     */
    public static Task create(String id, String title, String parent, JsonNode meta) {
        Instant now = Instant.now();
        return new Task(
            id,
            parent,
            title != null ? title : "untitled",
            TaskStatus.PENDING,
            List.of(),
            meta,
            null,
            null,
            now,
            now
        );
    }

    public Optional<Step> findStep(String stepId) {
        return steps.stream()
            .filter(s -> s.id().equals(stepId))
            .findFirst();
    }

    public Task withStepAdded(Step step) {
        List<Step> appended = new ArrayList<>(steps);
        appended.add(step);
        return new Task(id, parent, title, status, appended, meta, result, error, createdAt, Instant.now());
    }

    /**
     * Replace the step with the same id, keeping its position.
     */
    public Task withStepReplaced(Step step) {
        List<Step> replaced = new ArrayList<>(steps.size());
        for (Step existing : steps) {
            replaced.add(existing.id().equals(step.id()) ? step : existing);
        }
        return new Task(id, parent, title, status, replaced, meta, result, error, createdAt, Instant.now());
    }

    public Task withStarted() {
        status.checkTransition(TaskStatus.RUNNING, "Task");
        return new Task(id, parent, title, TaskStatus.RUNNING, steps, meta, result, error, createdAt, Instant.now());
    }

    public Task withCompleted(JsonNode taskResult) {
        status.checkTransition(TaskStatus.COMPLETED, "Task");
        return new Task(id, parent, title, TaskStatus.COMPLETED, steps, meta, taskResult, null, createdAt, Instant.now());
    }

    public Task withFailed(String taskError) {
        status.checkTransition(TaskStatus.FAILED, "Task");
        return new Task(id, parent, title, TaskStatus.FAILED, steps, meta, null, taskError, createdAt, Instant.now());
    }

    public Task withCancelled(String reason) {
        status.checkTransition(TaskStatus.CANCELLED, "Task");
        return new Task(id, parent, title, TaskStatus.CANCELLED, steps, meta, null, reason, createdAt, Instant.now());
    }
}
