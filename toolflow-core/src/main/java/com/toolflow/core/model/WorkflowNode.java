package com.toolflow.core.model;

import java.time.Instant;
import java.util.Set;

/**
 * Snapshot of one node of the workflow dependency graph.
 * The id is the id of the {@link Task} the node schedules.
 */
public record WorkflowNode(
    String id,
    Set<String> deps,
    Set<String> dependents,
    Instant createdAt
) {
    public WorkflowNode {
        deps = deps != null ? Set.copyOf(deps) : Set.of();
        dependents = dependents != null ? Set.copyOf(dependents) : Set.of();
    }

    public static WorkflowNode create(String id) {
        return new WorkflowNode(id, Set.of(), Set.of(), Instant.now());
    }
}
