package com.toolflow.engine.workflow;

import java.util.List;

/**
 * One node of a graph handed to {@link WorkflowEngine#runGraph}.
 */
public record WorkflowStep(
    String id,
    WorkUnit work,
    List<String> dependsOn,
    ScheduleOptions options
) {
    public WorkflowStep {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id must not be blank");
        }
        if (work == null) {
            throw new IllegalArgumentException("Step " + id + " has no work unit");
        }
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        options = options != null ? options : ScheduleOptions.defaults();
    }

    public static WorkflowStep of(String id, WorkUnit work, String... dependsOn) {
        return new WorkflowStep(id, work, List.of(dependsOn), null);
    }
}
