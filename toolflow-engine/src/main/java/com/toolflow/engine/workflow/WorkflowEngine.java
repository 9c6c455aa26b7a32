package com.toolflow.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.toolflow.core.exception.DependencyFailedException;
import com.toolflow.core.exception.DependencyTimeoutException;
import com.toolflow.core.exception.HandlerFailureException;
import com.toolflow.core.exception.InvalidStateTransitionException;
import com.toolflow.core.exception.ToolflowException;
import com.toolflow.core.exception.UnitCancelledException;
import com.toolflow.core.exception.WorkflowValidationException;
import com.toolflow.core.model.Event;
import com.toolflow.core.model.EventNames;
import com.toolflow.core.model.RetryPolicy;
import com.toolflow.core.model.Task;
import com.toolflow.core.model.TaskStatus;
import com.toolflow.core.model.WorkflowNode;
import com.toolflow.core.repository.WorkflowNodeRepository;
import com.toolflow.engine.event.EventBus;
import com.toolflow.engine.event.Subscription;
import com.toolflow.engine.logging.LoggingContext;
import com.toolflow.engine.metrics.ToolflowMetrics;
import com.toolflow.engine.task.TaskManager;
import com.toolflow.worker.CancellationToken;
import com.toolflow.worker.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs units of work as a dependency graph with bounded concurrency and per-unit retry.
 *
 * Unit lifecycle: queued, waiting on dependencies, running, then completed or failed.
 * Each unit id is a {@link Task} id; the unit's progress is visible through {@link TaskManager}.
 *
 * Dependency waits are driven by task completion events and hold no worker slot; only
 * execution is bounded by the worker pool. A dependency that fails or is cancelled fails
 * its dependents with {@link DependencyFailedException} without running them. Retries
 * use exponential backoff from the unit's {@link RetryPolicy}.
 *
 * Cancellation is cooperative. A cancelled unit stops at the next checkpoint: admission
 * to the worker pool, the start of an attempt, or the scheduling of a retry.
 */
public class WorkflowEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final TaskManager taskManager;
    private final EventBus eventBus;
    private final WorkflowNodeRepository nodeRepository;
    private final ToolflowMetrics metrics;
    private final RetryPolicy defaultRetryPolicy;
    private final Duration defaultDependencyTimeout;
    private final ExecutorService workers;
    private final ScheduledExecutorService coordinator;

    private final Map<String, GraphNode> graph = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<TaskStatus>> settledSignals = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, ScheduledUnit> units = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new ArrayList<>();

    public WorkflowEngine(TaskManager taskManager, EventBus eventBus, int concurrency) {
        this(taskManager, eventBus, null, null, concurrency, RetryPolicy.noRetry(), Duration.ofMinutes(5));
    }

    /**
     * @param taskManager registry holding the unit tasks
     * @param eventBus bus carrying task completion events; required for dependency waits
     * @param nodeRepository graph node store, or null for none
     * @param metrics meters, or null for a private registry
     * @param concurrency number of units that may execute at once
     * @param defaultRetryPolicy policy for units scheduled without an explicit retry count
     * @param defaultDependencyTimeout bound on dependency waits; null or zero waits forever
     */
    public WorkflowEngine(TaskManager taskManager, EventBus eventBus, WorkflowNodeRepository nodeRepository,
                          ToolflowMetrics metrics, int concurrency, RetryPolicy defaultRetryPolicy,
                          Duration defaultDependencyTimeout) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.taskManager = taskManager;
        this.eventBus = eventBus;
        this.nodeRepository = nodeRepository;
        this.metrics = metrics != null ? metrics : ToolflowMetrics.detached();
        this.defaultRetryPolicy = defaultRetryPolicy != null ? defaultRetryPolicy : RetryPolicy.noRetry();
        this.defaultDependencyTimeout = defaultDependencyTimeout;
        this.workers = Executors.newFixedThreadPool(concurrency, namedThreads("toolflow-worker"));
        this.coordinator = Executors.newSingleThreadScheduledExecutor(namedThreads("toolflow-coordinator"));

        subscriptions.add(eventBus.subscribe(EventNames.TASK_COMPLETED, e -> signalSettled(e, TaskStatus.COMPLETED)));
        subscriptions.add(eventBus.subscribe(EventNames.TASK_FAILED, e -> signalSettled(e, TaskStatus.FAILED)));
        subscriptions.add(eventBus.subscribe(EventNames.TASK_CANCELLED, e -> signalSettled(e, TaskStatus.CANCELLED)));
        log.info("Workflow engine started with {} workers", concurrency);
    }

    // ========== Graph ==========

    /**
     * Add a node to the graph. Registering an existing id does nothing.
     */
    public void registerTask(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Unit id must not be blank");
        }
        boolean[] created = new boolean[1];
        GraphNode node = graph.computeIfAbsent(id, k -> {
            created[0] = true;
            return new GraphNode(k);
        });
        if (created[0]) {
            persistNode(node);
        }
    }

    /**
     * Record that {@code taskId} may not run before {@code dependsOn} completes.
     */
    public void addDependency(String taskId, String dependsOn) {
        registerTask(taskId);
        registerTask(dependsOn);
        GraphNode node = graph.get(taskId);
        GraphNode upstream = graph.get(dependsOn);
        boolean added = node.deps.add(dependsOn);
        upstream.dependents.add(taskId);
        if (added) {
            persistNode(node);
            persistNode(upstream);
        }
    }

    public Optional<WorkflowNode> getNode(String id) {
        return Optional.ofNullable(graph.get(id)).map(GraphNode::snapshot);
    }

    // ========== Scheduling ==========

    /**
     * Schedule one unit. The unit's task is created if it does not exist.
     *
     * @return future completed with the unit's result, or exceptionally with its final error
     * @throws WorkflowValidationException if the id is already scheduled or its task already settled
     */
    public CompletableFuture<JsonNode> scheduleTask(String id, WorkUnit work, ScheduleOptions options) {
        ScheduleOptions opts = options != null ? options : ScheduleOptions.defaults();
        checkSchedulable(id);
        registerTask(id);
        for (String dep : opts.dependsOn()) {
            addDependency(id, dep);
        }
        taskManager.ensureTask(id, opts.title());

        RetryPolicy policy = opts.retries() != null
            ? defaultRetryPolicy.retries(opts.retries())
            : defaultRetryPolicy;
        Duration timeout = opts.dependencyTimeout() != null ? opts.dependencyTimeout() : defaultDependencyTimeout;

        ScheduledUnit unit = new ScheduledUnit(id, work, policy, tokenFor(id));
        if (units.putIfAbsent(id, unit) != null) {
            throw new WorkflowValidationException("id", "unit " + id + " is already scheduled");
        }

        Set<String> deps = Set.copyOf(graph.get(id).deps);
        Map<String, Object> queued = new LinkedHashMap<>();
        queued.put("taskId", id);
        queued.put("dependsOn", new TreeSet<>(deps));
        queued.put("retries", policy.retries());
        eventBus.emit(EventNames.UNIT_QUEUED, queued);
        log.debug("Queued unit {} waiting on {}", id, deps);

        unit.ready = awaitDependencies(id, deps, timeout);
        unit.ready.whenCompleteAsync((ignored, error) -> {
            if (error != null) {
                settleBlocked(unit, unwrap(error));
            } else {
                admit(unit);
            }
        }, coordinator);
        return unit.outcome;
    }

    /**
     * Validate, register and schedule a whole graph.
     *
     * @return future completed once every unit has settled, with one outcome per step in input order
     * @throws WorkflowValidationException on duplicate step ids, a dependency cycle, or a step id that is
     *         already scheduled or settled; nothing is scheduled
     */
    public CompletableFuture<List<UnitOutcome>> runGraphAsync(List<WorkflowStep> steps) {
        validateGraph(steps);
        for (WorkflowStep step : steps) {
            checkSchedulable(step.id());
        }

        for (WorkflowStep step : steps) {
            registerTask(step.id());
            taskManager.ensureTask(step.id(), step.options().title());
        }
        for (WorkflowStep step : steps) {
            for (String dep : step.dependsOn()) {
                addDependency(step.id(), dep);
            }
        }

        List<CompletableFuture<UnitOutcome>> outcomes = new ArrayList<>(steps.size());
        for (WorkflowStep step : steps) {
            Set<String> deps = new LinkedHashSet<>(step.dependsOn());
            deps.addAll(step.options().dependsOn());
            ScheduleOptions options = new ScheduleOptions(deps, step.options().retries(),
                step.options().dependencyTimeout(), step.options().title());
            outcomes.add(scheduleTask(step.id(), step.work(), options)
                .handle((value, error) -> error == null
                    ? UnitOutcome.fulfilled(step.id(), value)
                    : UnitOutcome.rejected(step.id(), unwrap(error))));
        }

        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0]))
            .thenApply(v -> outcomes.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList()));
    }

    /**
     * Blocking form of {@link #runGraphAsync}.
     */
    public List<UnitOutcome> runGraph(List<WorkflowStep> steps) throws InterruptedException {
        try {
            return runGraphAsync(steps).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Graph run failed unexpectedly", e.getCause());
        }
    }

    /**
     * Request cancellation of a unit. Works before the unit is scheduled too.
     *
     * @return true if this call cancelled the unit; false if it was already cancelled or has settled
     */
    public boolean cancel(String id, String reason) {
        ScheduledUnit unit = units.get(id);
        if (unit == null && isSettled(id)) {
            return false;
        }
        boolean cancelled = tokenFor(id).cancel(reason);
        if (unit != null && unit.ready != null) {
            unit.ready.completeExceptionally(new UnitCancelledException(id));
        }
        if (cancelled) {
            log.info("Cancellation requested for unit {}: {}", id, reason);
        }
        return cancelled;
    }

    // ========== Dependency wait ==========

    private CompletableFuture<Void> awaitDependencies(String id, Set<String> deps, Duration timeout) {
        if (deps.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> ready = new CompletableFuture<>();
        Set<String> pending = ConcurrentHashMap.newKeySet();
        pending.addAll(deps);

        for (String dep : deps) {
            awaitSettled(dep).whenComplete((status, error) -> {
                if (status == TaskStatus.COMPLETED) {
                    pending.remove(dep);
                    if (pending.isEmpty()) {
                        ready.complete(null);
                    }
                } else {
                    ready.completeExceptionally(new DependencyFailedException(dep));
                }
            });
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative() && !ready.isDone()) {
            ScheduledFuture<?> timer = coordinator.schedule(
                () -> ready.completeExceptionally(new DependencyTimeoutException(id, Set.copyOf(pending), timeout)),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
            ready.whenComplete((v, e) -> timer.cancel(false));
        }
        return ready;
    }

    /**
     * Signal completed with the dependency's terminal status. Registered before the
     * current status is read so a completion between the two cannot be missed.
     */
    private CompletableFuture<TaskStatus> awaitSettled(String dep) {
        CompletableFuture<TaskStatus> signal = settledSignals.computeIfAbsent(dep, k -> new CompletableFuture<>());
        taskManager.findTask(dep)
            .map(Task::status)
            .filter(TaskStatus::isTerminal)
            .ifPresent(status -> {
                settledSignals.remove(dep, signal);
                signal.complete(status);
            });
        return signal;
    }

    /**
     * Wake the waiters on a settled task. The signal is dropped; later waiters read the task status.
     */
    private void signalSettled(Event event, TaskStatus status) {
        String id = event.payload().path("id").asText(null);
        if (id == null) {
            return;
        }
        CompletableFuture<TaskStatus> signal = settledSignals.remove(id);
        if (signal != null) {
            signal.complete(status);
        }
    }

    // ========== Execution ==========

    private void admit(ScheduledUnit unit) {
        if (unit.token.isCancelled()) {
            settleCancelled(unit);
            return;
        }
        submit(unit, 1);
    }

    private void submit(ScheduledUnit unit, int attemptNumber) {
        try {
            workers.execute(() -> attempt(unit, attemptNumber));
        } catch (RejectedExecutionException e) {
            log.warn("Engine closed, dropping unit {}", unit.id);
            reject(unit, e);
        }
    }

    private void attempt(ScheduledUnit unit, int attemptNumber) {
        try (LoggingContext ignored = LoggingContext.forUnit(unit.id, attemptNumber)) {
            if (unit.token.isCancelled()) {
                settleCancelled(unit);
                return;
            }
            if (attemptNumber == 1) {
                startTaskIfPending(unit.id);
            }
            Map<String, Object> started = new LinkedHashMap<>();
            started.put("taskId", unit.id);
            started.put("attempt", attemptNumber);
            eventBus.emit(EventNames.UNIT_STARTED, started);

            JsonNode value = null;
            Exception failure = null;
            metrics.unitStarted();
            try {
                value = unit.work.execute(unit.token);
            } catch (Exception e) {
                failure = e;
            } catch (Error e) {
                settleFailed(unit, e, attemptNumber);
                throw e;
            } finally {
                metrics.unitFinished();
            }

            if (failure != null) {
                onAttemptFailed(unit, attemptNumber, failure);
            } else {
                settleCompleted(unit, value, attemptNumber);
            }
        } catch (RuntimeException e) {
            log.error("Unit {} bookkeeping failed: {}", unit.id, e.getMessage(), e);
            reject(unit, e);
        }
    }

    private void onAttemptFailed(ScheduledUnit unit, int attemptNumber, Exception error) {
        if (unit.token.isCancelled()) {
            settleCancelled(unit);
            return;
        }
        String errorCode = errorCode(error);
        if (isRetryable(error) && unit.policy.shouldRetry(errorCode) && unit.policy.hasMoreAttempts(attemptNumber)) {
            Duration delay = unit.policy.computeBackoff(attemptNumber);
            log.info("Unit {} attempt {} failed [{}], retrying in {} ms: {}",
                unit.id, attemptNumber, errorCode, delay.toMillis(), describe(error));
            metrics.unitRetried();

            Map<String, Object> retrying = new LinkedHashMap<>();
            retrying.put("taskId", unit.id);
            retrying.put("attempt", attemptNumber);
            retrying.put("nextAttempt", attemptNumber + 1);
            retrying.put("delayMs", delay.toMillis());
            retrying.put("error", describe(error));
            eventBus.emit(EventNames.UNIT_RETRYING, retrying);

            try {
                coordinator.schedule(() -> submit(unit, attemptNumber + 1), delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("Engine closed, dropping retry of unit {}", unit.id);
                reject(unit, error);
            }
            return;
        }
        settleFailed(unit, error, attemptNumber);
    }

    // ========== Settlement ==========

    private void settleCompleted(ScheduledUnit unit, JsonNode value, int attempts) {
        taskManager.completeTask(unit.id, value);

        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("taskId", unit.id);
        completed.put("attempts", attempts);
        eventBus.emit(EventNames.UNIT_COMPLETED, completed);
        metrics.unitSettled("completed");
        log.debug("Unit {} completed after {} attempt(s)", unit.id, attempts);
        release(unit);
        unit.outcome.complete(value);
    }

    private void settleFailed(ScheduledUnit unit, Throwable error, int attempts) {
        String message = describe(error);
        closeTask(unit.id, () -> taskManager.failTask(unit.id, message));

        Map<String, Object> failed = new LinkedHashMap<>();
        failed.put("taskId", unit.id);
        failed.put("attempts", attempts);
        failed.put("errorCode", errorCode(error));
        failed.put("error", message);
        eventBus.emit(EventNames.UNIT_FAILED, failed);
        metrics.unitSettled("failed");
        log.warn("Unit {} failed after {} attempt(s): {}", unit.id, attempts, message);
        reject(unit, error);
    }

    /**
     * Settle a unit that never ran because its dependency wait ended badly.
     */
    private void settleBlocked(ScheduledUnit unit, Throwable error) {
        try (LoggingContext ignored = LoggingContext.forUnit(unit.id, 0)) {
            if (error instanceof UnitCancelledException) {
                settleCancelled(unit);
            } else {
                settleFailed(unit, error, 0);
            }
        } catch (RuntimeException e) {
            log.error("Unit {} bookkeeping failed: {}", unit.id, e.getMessage(), e);
            reject(unit, error);
        }
    }

    private void settleCancelled(ScheduledUnit unit) {
        String reason = unit.token.getReason();
        closeTask(unit.id, () -> taskManager.cancelTask(unit.id, reason));

        Map<String, Object> failed = new LinkedHashMap<>();
        failed.put("taskId", unit.id);
        failed.put("errorCode", UnitCancelledException.ERROR_CODE);
        failed.put("error", reason);
        eventBus.emit(EventNames.UNIT_FAILED, failed);
        metrics.unitSettled("cancelled");
        log.info("Unit {} cancelled: {}", unit.id, reason);
        reject(unit, new UnitCancelledException(unit.id));
    }

    /**
     * Forget a settled unit. Runs before its outcome completes so callers never see it as scheduled.
     */
    private void release(ScheduledUnit unit) {
        units.remove(unit.id, unit);
        tokens.remove(unit.id, unit.token);
    }

    private void reject(ScheduledUnit unit, Throwable error) {
        release(unit);
        unit.outcome.completeExceptionally(error);
    }

    private void checkSchedulable(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Unit id must not be blank");
        }
        if (units.containsKey(id)) {
            throw new WorkflowValidationException("id", "unit " + id + " is already scheduled");
        }
        taskManager.findTask(id)
            .map(Task::status)
            .filter(TaskStatus::isTerminal)
            .ifPresent(status -> {
                throw new WorkflowValidationException("id", "task " + id + " already settled as " + status);
            });
    }

    private boolean isSettled(String id) {
        return taskManager.findTask(id).map(t -> t.status().isTerminal()).orElse(false);
    }

    private void startTaskIfPending(String id) {
        if (taskManager.getTask(id).status() == TaskStatus.PENDING) {
            taskManager.startTask(id);
        }
    }

    /**
     * Apply a terminal task transition unless the task already reached a terminal state.
     */
    private void closeTask(String id, Runnable transition) {
        if (isSettled(id)) {
            return;
        }
        try {
            transition.run();
        } catch (InvalidStateTransitionException e) {
            log.debug("Task {} settled concurrently: {}", id, e.getMessage());
        }
    }

    // ========== Helpers ==========

    private static String errorCode(Throwable error) {
        if (error instanceof HandlerFailureException handlerFailure) {
            return handlerFailure.getHandlerErrorCode();
        }
        if (error instanceof ToolflowException toolflowException) {
            return toolflowException.getErrorCode();
        }
        if (error instanceof ToolException toolException) {
            return toolException.getErrorCode();
        }
        return HandlerFailureException.ERROR_CODE;
    }

    private static boolean isRetryable(Throwable error) {
        if (error instanceof HandlerFailureException handlerFailure) {
            return handlerFailure.isRetryable();
        }
        if (error instanceof ToolException toolException) {
            return toolException.isRetryable();
        }
        return true;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private CancellationToken tokenFor(String id) {
        return tokens.computeIfAbsent(id, k -> new CancellationToken());
    }

    int activeUnitCount() {
        return units.size();
    }

    int pendingSignalCount() {
        return settledSignals.size();
    }

    private void persistNode(GraphNode node) {
        if (nodeRepository == null) {
            return;
        }
        try {
            nodeRepository.save(node.snapshot());
        } catch (Exception e) {
            log.warn("Failed to persist workflow node {}: {}", node.id, e.getMessage());
        }
    }

    /**
     * Reject duplicate ids and cycles among the steps of one graph.
     * Dependencies on ids outside the graph are not edges here; they are waited on at run time.
     */
    static void validateGraph(List<WorkflowStep> steps) {
        if (steps == null) {
            throw new WorkflowValidationException("steps", "must not be null");
        }
        Map<String, WorkflowStep> byId = new LinkedHashMap<>();
        for (WorkflowStep step : steps) {
            if (byId.putIfAbsent(step.id(), step) != null) {
                throw new WorkflowValidationException("steps", "duplicate step id " + step.id());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (WorkflowStep step : steps) {
            Set<String> deps = new LinkedHashSet<>(step.dependsOn());
            deps.addAll(step.options().dependsOn());
            int degree = 0;
            for (String dep : deps) {
                if (byId.containsKey(dep)) {
                    degree++;
                    dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.id());
                }
            }
            inDegree.put(step.id(), degree);
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited++;
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (visited < byId.size()) {
            Set<String> cyclic = inDegree.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
            throw new WorkflowValidationException("steps", "dependency cycle among " + cyclic);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        subscriptions.forEach(Subscription::unsubscribe);
        coordinator.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Workflow engine stopped");
    }

    private static final class GraphNode {
        private final String id;
        private final Instant createdAt = Instant.now();
        private final Set<String> deps = ConcurrentHashMap.newKeySet();
        private final Set<String> dependents = ConcurrentHashMap.newKeySet();

        GraphNode(String id) {
            this.id = id;
        }

        WorkflowNode snapshot() {
            return new WorkflowNode(id, deps, dependents, createdAt);
        }
    }

    private static final class ScheduledUnit {
        private final String id;
        private final WorkUnit work;
        private final RetryPolicy policy;
        private final CancellationToken token;
        private final CompletableFuture<JsonNode> outcome = new CompletableFuture<>();
        private volatile CompletableFuture<Void> ready;

        ScheduledUnit(String id, WorkUnit work, RetryPolicy policy, CancellationToken token) {
            this.id = id;
            this.work = work;
            this.policy = policy;
            this.token = token;
        }
    }
}
