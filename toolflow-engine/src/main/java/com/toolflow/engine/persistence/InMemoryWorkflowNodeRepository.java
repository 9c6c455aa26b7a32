package com.toolflow.engine.persistence;

import com.toolflow.core.model.WorkflowNode;
import com.toolflow.core.repository.WorkflowNodeRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowNodeRepository.
 */
public class InMemoryWorkflowNodeRepository implements WorkflowNodeRepository {

    private final Map<String, WorkflowNode> nodes = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowNode node) {
        nodes.put(node.id(), node);
    }

    @Override
    public Optional<WorkflowNode> findById(String id) {
        return Optional.ofNullable(nodes.get(id));
    }
}
