package com.toolflow.engine.persistence;

import com.toolflow.core.model.ToolRun;
import com.toolflow.core.repository.ToolRunRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ToolRunRepository.
 */
public class InMemoryToolRunRepository implements ToolRunRepository {

    private final Map<String, ToolRun> runs = new ConcurrentHashMap<>();

    @Override
    public void save(ToolRun run) {
        runs.putIfAbsent(run.id(), run);
    }

    @Override
    public Optional<ToolRun> findById(String id) {
        return Optional.ofNullable(runs.get(id));
    }

    @Override
    public List<ToolRun> findByToolName(String toolName) {
        return runs.values().stream()
            .filter(r -> r.toolName().equals(toolName))
            .sorted(Comparator.comparing(ToolRun::startedAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<ToolRun> findAll() {
        return runs.values().stream()
            .sorted(Comparator.comparing(ToolRun::startedAt))
            .collect(Collectors.toList());
    }
}
