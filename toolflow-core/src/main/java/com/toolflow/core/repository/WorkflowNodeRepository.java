package com.toolflow.core.repository;

import com.toolflow.core.model.WorkflowNode;

import java.util.Optional;

/**
 * Storage for dependency graph nodes.
 */
public interface WorkflowNodeRepository {

    /**
     * Insert or replace a node snapshot.
     *
     * @param node The node to save
     */
    void save(WorkflowNode node);

    Optional<WorkflowNode> findById(String id);
}
