package com.toolflow.engine.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.toolflow.core.exception.NotFoundException;
import com.toolflow.core.model.EventNames;
import com.toolflow.core.model.Step;
import com.toolflow.core.model.Task;
import com.toolflow.core.model.TaskStatus;
import com.toolflow.core.repository.TaskRepository;
import com.toolflow.engine.event.EventBus;
import com.toolflow.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Registry of tasks and their steps.
 *
 * The in-memory index is authoritative. Each mutation runs under a per-task lock,
 * replaces the indexed copy, writes it to the repository (best-effort) and only then
 * publishes events, after the lock is released. Every mutation emits its specific
 * event followed by {@code task.updated}.
 *
 * Readers get immutable snapshots; nothing returned here can change the registry.
 */
public class TaskManager {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    private static final String ENTITY_TASK = "Task";
    private static final String ENTITY_STEP = "Step";

    private final TaskRepository taskRepository;
    private final EventBus eventBus;
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, Object> taskLocks = new ConcurrentHashMap<>();

    /**
     * @param taskRepository durable store, or null for memory only
     * @param eventBus bus for lifecycle events, or null for none
     */
    public TaskManager(TaskRepository taskRepository, EventBus eventBus) {
        this.taskRepository = taskRepository;
        this.eventBus = eventBus;
    }

    /**
     * Load previously stored tasks into the index. Tasks already indexed are kept.
     *
     * @return number of tasks loaded
     */
    public int hydrate() {
        if (taskRepository == null) {
            return 0;
        }
        List<Task> stored;
        try {
            stored = taskRepository.findAll();
        } catch (Exception e) {
            log.warn("Failed to load stored tasks: {}", e.getMessage());
            return 0;
        }
        int loaded = 0;
        for (Task task : stored) {
            if (tasks.putIfAbsent(task.id(), task) == null) {
                loaded++;
            }
        }
        log.info("Hydrated {} tasks from storage", loaded);
        return loaded;
    }

    // ========== Task lifecycle ==========

    /**
     * Create a task in PENDING state.
     *
     * @param title display title, "untitled" when null
     * @param parent optional parent task id
     * @param meta optional metadata, copied
     */
    public Task createTask(String title, String parent, JsonNode meta) {
        Task task = Task.create(title, parent, meta);
        synchronized (lockFor(task.id())) {
            tasks.put(task.id(), task);
            persistNew(task);
        }
        log.debug("Created task {} ({})", task.id(), task.title());
        emitTask(EventNames.TASK_CREATED, task);
        return task;
    }

    /**
     * Return the task with the given id, creating it in PENDING state if it does not exist yet.
     */
    public Task ensureTask(String taskId, String title) {
        Task created;
        synchronized (lockFor(taskId)) {
            Task existing = tasks.get(taskId);
            if (existing != null) {
                return existing;
            }
            created = Task.create(taskId, title != null ? title : taskId, null, null);
            tasks.put(taskId, created);
            persistNew(created);
        }
        log.debug("Created task {} on demand", taskId);
        emitTask(EventNames.TASK_CREATED, created);
        return created;
    }

    public Task startTask(String taskId) {
        Task task = mutate(taskId, Task::withStarted);
        log.debug("Started task {}", taskId);
        emitTask(EventNames.TASK_STARTED, task);
        return task;
    }

    /**
     * Mark a task completed. A task still PENDING passes through RUNNING first.
     */
    public Task completeTask(String taskId, JsonNode result) {
        startIfPending(taskId);
        Task task = mutate(taskId, t -> t.withCompleted(result));
        log.debug("Completed task {}", taskId);
        emitTask(EventNames.TASK_COMPLETED, task);
        return task;
    }

    /**
     * Mark a task failed. A task still PENDING passes through RUNNING first.
     */
    public Task failTask(String taskId, String error) {
        startIfPending(taskId);
        Task task = mutate(taskId, t -> t.withFailed(error));
        log.debug("Failed task {}: {}", taskId, error);
        emitTask(EventNames.TASK_FAILED, task);
        return task;
    }

    public Task cancelTask(String taskId, String reason) {
        Task task = mutate(taskId, t -> t.withCancelled(reason != null ? reason : "cancelled"));
        log.debug("Cancelled task {}: {}", taskId, reason);
        emitTask(EventNames.TASK_CANCELLED, task);
        return task;
    }

    // ========== Steps ==========

    public Step addStep(String taskId, String description, JsonNode meta) {
        Step step = Step.create(description, meta);
        Task task = mutate(taskId, t -> t.withStepAdded(step));
        emitStep(EventNames.STEP_ADDED, task, step);
        return step;
    }

    public Step startStep(String taskId, String stepId) {
        return changeStep(taskId, stepId, Step::withStarted, EventNames.STEP_STARTED);
    }

    public Step completeStep(String taskId, String stepId, JsonNode result) {
        return changeStep(taskId, stepId, s -> s.withCompleted(result), EventNames.STEP_COMPLETED);
    }

    public Step failStep(String taskId, String stepId, String error) {
        return changeStep(taskId, stepId, s -> s.withFailed(error), EventNames.STEP_FAILED);
    }

    // ========== Reads ==========

    public Optional<Task> findTask(String taskId) {
        return taskId != null ? Optional.ofNullable(tasks.get(taskId)) : Optional.empty();
    }

    public Task getTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new NotFoundException(ENTITY_TASK, taskId));
    }

    /**
     * @return snapshot of every task, oldest first
     */
    public List<Task> listTasks() {
        List<Task> snapshot = new ArrayList<>(tasks.values());
        snapshot.sort(Comparator.comparing(Task::createdAt).thenComparing(Task::id));
        return snapshot;
    }

    // ========== Internals ==========

    private void startIfPending(String taskId) {
        if (getTask(taskId).status() == TaskStatus.PENDING) {
            Task started = mutateIf(taskId, t -> t.status() == TaskStatus.PENDING ? t.withStarted() : null);
            if (started != null) {
                emitTask(EventNames.TASK_STARTED, started);
            }
        }
    }

    private Step changeStep(String taskId, String stepId, UnaryOperator<Step> change, String eventName) {
        Step[] changed = new Step[1];
        Task task;
        try (LoggingContext ignored = LoggingContext.forTask(taskId, stepId)) {
            task = mutate(taskId, t -> {
                Step current = t.findStep(stepId)
                    .orElseThrow(() -> new NotFoundException(ENTITY_STEP, stepId));
                changed[0] = change.apply(current);
                return t.withStepReplaced(changed[0]);
            });
            log.debug("Step {} of task {} is now {}", stepId, taskId, changed[0].status().wireName());
        }
        emitStep(eventName, task, changed[0]);
        return changed[0];
    }

    private Task mutate(String taskId, UnaryOperator<Task> change) {
        Task updated = mutateIf(taskId, change);
        if (updated == null) {
            throw new IllegalStateException("Task change produced no task: " + taskId);
        }
        return updated;
    }

    /**
     * Apply a change under the task's lock. A change returning null leaves the task untouched.
     */
    private Task mutateIf(String taskId, UnaryOperator<Task> change) {
        if (!tasks.containsKey(taskId)) {
            throw new NotFoundException(ENTITY_TASK, taskId);
        }
        synchronized (lockFor(taskId)) {
            Task current = tasks.get(taskId);
            if (current == null) {
                throw new NotFoundException(ENTITY_TASK, taskId);
            }
            Task updated = change.apply(current);
            if (updated == null) {
                return null;
            }
            tasks.put(taskId, updated);
            persistUpdate(updated);
            return updated;
        }
    }

    private void persistNew(Task task) {
        if (taskRepository == null) {
            return;
        }
        try {
            taskRepository.save(task);
        } catch (Exception e) {
            log.warn("Failed to persist new task {}: {}", task.id(), e.getMessage());
        }
    }

    private void persistUpdate(Task task) {
        if (taskRepository == null) {
            return;
        }
        try {
            taskRepository.update(task);
        } catch (Exception e) {
            log.warn("Failed to persist task {}: {}", task.id(), e.getMessage());
        }
    }

    private void emitTask(String eventName, Task task) {
        if (eventBus == null) {
            return;
        }
        eventBus.emit(eventName, task);
        eventBus.emit(EventNames.TASK_UPDATED, task);
    }

    private void emitStep(String eventName, Task task, Step step) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", task.id());
        payload.put("step", step);
        eventBus.emit(eventName, payload);
        eventBus.emit(EventNames.TASK_UPDATED, task);
    }

    /**
     * One lock per indexed task; ids that never reach the index get none.
     */
    private Object lockFor(String taskId) {
        return taskLocks.computeIfAbsent(taskId, k -> new Object());
    }
}
