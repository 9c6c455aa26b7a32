package com.toolflow.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Every log line written inside the block carries the ids of the task, tool run or unit being processed.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTool(toolName, runId, taskId)) {
 *     log.info("Invoking handler"); // includes toolName, toolRunId, taskId
 * }
 * </pre>
 *
 * Contexts nest: closing an inner context restores the values the outer one had set.
 * The outermost context on a thread opens a trace id and removes it again on close.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String STEP_ID = "stepId";
    public static final String TOOL_NAME = "toolName";
    public static final String TOOL_RUN_ID = "toolRunId";
    public static final String UNIT_ID = "unitId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
    }

    /**
     * Create a logging context for task bookkeeping.
     */
    public static LoggingContext forTask(String taskId, String stepId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(TASK_ID, taskId);
        ctx.put(STEP_ID, stepId);
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a single tool call.
     */
    public static LoggingContext forTool(String toolName, String toolRunId, String taskId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(TOOL_NAME, toolName);
        ctx.put(TOOL_RUN_ID, toolRunId);
        ctx.put(TASK_ID, taskId);
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one attempt of a scheduled unit.
     */
    public static LoggingContext forUnit(String unitId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(UNIT_ID, unitId);
        ctx.put(TASK_ID, unitId);
        ctx.put(ATTEMPT, String.valueOf(attempt));
        ctx.ensureTraceId();
        return ctx;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    private void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}
