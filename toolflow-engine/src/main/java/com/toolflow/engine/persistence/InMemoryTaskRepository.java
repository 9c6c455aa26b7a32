package com.toolflow.engine.persistence;

import com.toolflow.core.model.Task;
import com.toolflow.core.repository.TaskRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRepository.
 * For tests and single-process use without a database.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public void update(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<Task> findById(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public List<Task> findAll() {
        return tasks.values().stream()
            .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::id))
            .collect(Collectors.toList());
    }
}
