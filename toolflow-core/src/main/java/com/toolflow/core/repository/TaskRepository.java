package com.toolflow.core.repository;

import com.toolflow.core.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for tasks and their steps.
 */
public interface TaskRepository {

    /**
     * Save a newly created task.
     *
     * @param task The task to save
     */
    void save(Task task);

    /**
     * Overwrite the stored copy of an existing task, steps included.
     *
     * @param task The task to update
     */
    void update(Task task);

    /**
     * Find a task by ID.
     *
     * @param id The task ID
     * @return The task if found
     */
    Optional<Task> findById(String id);

    /**
     * Load every stored task. Used to hydrate the in-memory index at startup.
     *
     * @return All tasks ordered by creation time
     */
    List<Task> findAll();
}
