package com.toolflow.core.model;

/**
 * Names of the events emitted by the engine.
 */
public final class EventNames {

    // Task lifecycle
    public static final String TASK_CREATED = "task.created";
    public static final String TASK_UPDATED = "task.updated";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_CANCELLED = "task.cancelled";

    // Step lifecycle
    public static final String STEP_ADDED = "task.step.added";
    public static final String STEP_STARTED = "task.step.started";
    public static final String STEP_COMPLETED = "task.step.completed";
    public static final String STEP_FAILED = "task.step.failed";

    // Tool calls
    public static final String TOOL_START = "tool.start";
    public static final String TOOL_LOG = "tool.log";
    public static final String TOOL_END = "tool.end";
    public static final String TOOL_ERROR = "tool.error";
    public static final String TOOL_REJECTED = "tool.rejected";
    public static final String TOOL_RECTIFIED = "tool.rectified";

    // Workflow units
    public static final String UNIT_QUEUED = "workflow.task.queued";
    public static final String UNIT_STARTED = "workflow.task.started";
    public static final String UNIT_RETRYING = "workflow.task.retrying";
    public static final String UNIT_COMPLETED = "workflow.task.completed";
    public static final String UNIT_FAILED = "workflow.task.failed";

    private EventNames() {
    }
}
