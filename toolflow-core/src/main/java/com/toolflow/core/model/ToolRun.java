package com.toolflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Audit record of a single tool execution attempt.
 * Written once and never updated; a rectified call that runs again is a new record.
 *
 * Invariants:
 * - exactly one of result / error is meaningful: error == null means success
 * - durationMs == finishedAt - startedAt
 */
public record ToolRun(
    String id,
    String toolName,
    JsonNode args,
    JsonNode result,
    String error,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    JsonNode contextMeta,
    boolean rectified,
    String taskId
) {
    public ToolRun {
        if (result != null && result.isNull()) {
            result = null;
        }
    }

    public static ToolRun succeeded(String id, String toolName, JsonNode args, JsonNode result,
                                    Instant startedAt, Instant finishedAt,
                                    JsonNode contextMeta, boolean rectified, String taskId) {
        return new ToolRun(id, toolName, args, result, null, startedAt, finishedAt,
            Duration.between(startedAt, finishedAt).toMillis(), contextMeta, rectified, taskId);
    }

    public static ToolRun failed(String id, String toolName, JsonNode args, String error,
                                 Instant startedAt, Instant finishedAt,
                                 JsonNode contextMeta, boolean rectified, String taskId) {
        return new ToolRun(id, toolName, args, null, error, startedAt, finishedAt,
            Duration.between(startedAt, finishedAt).toMillis(), contextMeta, rectified, taskId);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
