package com.toolflow.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.toolflow.core.exception.DependencyFailedException;
import com.toolflow.core.exception.DependencyTimeoutException;
import com.toolflow.core.exception.HandlerFailureException;
import com.toolflow.core.exception.UnitCancelledException;
import com.toolflow.core.exception.ValidationRejectedException;
import com.toolflow.core.exception.WorkflowValidationException;
import com.toolflow.core.json.ObjectMappers;
import com.toolflow.core.model.Event;
import com.toolflow.core.model.EventNames;
import com.toolflow.core.model.RetryPolicy;
import com.toolflow.core.model.TaskStatus;
import com.toolflow.engine.event.EventBus;
import com.toolflow.engine.metrics.ToolflowMetrics;
import com.toolflow.engine.persistence.InMemoryToolRunRepository;
import com.toolflow.engine.persistence.InMemoryWorkflowNodeRepository;
import com.toolflow.engine.task.TaskManager;
import com.toolflow.engine.tool.ToolRunner;
import com.toolflow.oracle.ValidationResult;
import com.toolflow.worker.ToolException;
import com.toolflow.worker.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class WorkflowEngineTest {

    private final ObjectMapper mapper = ObjectMappers.create();
    private final EventBus bus = new EventBus(null, mapper);
    private final TaskManager taskManager = new TaskManager(null, bus);
    private final InMemoryWorkflowNodeRepository nodes = new InMemoryWorkflowNodeRepository();
    private final ToolflowMetrics metrics = ToolflowMetrics.detached();
    private WorkflowEngine engine = newEngine(3);

    private WorkflowEngine newEngine(int concurrency) {
        return new WorkflowEngine(taskManager, bus, nodes, metrics, concurrency,
            RetryPolicy.withRetries(0, Duration.ofMillis(50)), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        engine.close();
        bus.close();
    }

    private static Throwable failureOf(CompletableFuture<?> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        throw new AssertionError("expected the unit to fail");
    }

    // ========== Graph runs ==========

    @Test
    @DisplayName("b runs only after a completed and both results are returned")
    void runGraph_dependentRunsAfterDependency() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        List<TaskStatus> aStatusWhenBStarts = new CopyOnWriteArrayList<>();

        List<UnitOutcome> outcomes = engine.runGraph(List.of(
            WorkflowStep.of("a", token -> {
                order.add("a");
                return IntNode.valueOf(1);
            }),
            WorkflowStep.of("b", token -> {
                aStatusWhenBStarts.add(taskManager.getTask("a").status());
                order.add("b");
                return IntNode.valueOf(2);
            }, "a")
        ));

        assertThat(outcomes).extracting(UnitOutcome::id).containsExactly("a", "b");
        assertThat(outcomes).allMatch(UnitOutcome::fulfilled);
        assertThat(outcomes).extracting(o -> o.value().asInt()).containsExactly(1, 2);
        assertThat(order).containsExactly("a", "b");
        assertThat(aStatusWhenBStarts).containsExactly(TaskStatus.COMPLETED);
        assertThat(taskManager.getTask("b").status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(taskManager.getTask("b").result().asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failure fails its dependent without running it")
    void runGraph_failedDependencyFailsFast() throws Exception {
        AtomicInteger bCalls = new AtomicInteger();

        List<UnitOutcome> outcomes = engine.runGraph(List.of(
            WorkflowStep.of("a", token -> {
                throw new IllegalStateException("x");
            }),
            WorkflowStep.of("b", token -> {
                bCalls.incrementAndGet();
                return IntNode.valueOf(9);
            }, "a")
        ));

        assertThat(outcomes.get(0).rejected()).isTrue();
        assertThat(outcomes.get(0).error()).hasMessage("x");
        assertThat(outcomes.get(1).rejected()).isTrue();
        assertThat(outcomes.get(1).error())
            .isInstanceOfSatisfying(DependencyFailedException.class,
                e -> assertThat(e.getDependencyId()).isEqualTo("a"));
        assertThat(bCalls).hasValue(0);
        assertThat(taskManager.getTask("a").status()).isEqualTo(TaskStatus.FAILED);
        assertThat(taskManager.getTask("a").error()).isEqualTo("x");
        assertThat(taskManager.getTask("b").status()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void runGraph_failureDoesNotCancelIndependentBranch() throws Exception {
        List<UnitOutcome> outcomes = engine.runGraph(List.of(
            WorkflowStep.of("a", token -> {
                throw new IllegalStateException("x");
            }),
            WorkflowStep.of("b", token -> IntNode.valueOf(2), "a"),
            WorkflowStep.of("c", token -> IntNode.valueOf(3)),
            WorkflowStep.of("d", token -> IntNode.valueOf(4), "c")
        ));

        assertThat(outcomes).extracting(UnitOutcome::fulfilled).containsExactly(false, false, true, true);
        assertThat(outcomes.get(3).value().asInt()).isEqualTo(4);
    }

    @Test
    void runGraph_shouldRejectCycleBeforeScheduling() {
        AtomicInteger calls = new AtomicInteger();
        WorkUnit counting = token -> {
            calls.incrementAndGet();
            return null;
        };

        assertThatThrownBy(() -> engine.runGraph(List.of(
            WorkflowStep.of("a", counting, "c"),
            WorkflowStep.of("b", counting, "a"),
            WorkflowStep.of("c", counting, "b"),
            WorkflowStep.of("d", counting)
        )))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("[a, b, c]");

        assertThat(calls).hasValue(0);
        assertThat(taskManager.listTasks()).isEmpty();
    }

    @Test
    void runGraph_shouldRejectSelfDependencyAndDuplicateIds() {
        assertThatThrownBy(() -> engine.runGraph(List.of(WorkflowStep.of("a", token -> null, "a"))))
            .isInstanceOf(WorkflowValidationException.class);
        assertThatThrownBy(() -> engine.runGraph(List.of(
            WorkflowStep.of("a", token -> null),
            WorkflowStep.of("a", token -> null))))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("duplicate");
    }

    @Test
    void runGraph_shouldPersistGraphNodes() throws Exception {
        engine.runGraph(List.of(
            WorkflowStep.of("a", token -> null),
            WorkflowStep.of("b", token -> null, "a")
        ));

        assertThat(nodes.findById("b")).get().satisfies(node -> assertThat(node.deps()).containsExactly("a"));
        assertThat(nodes.findById("a")).get().satisfies(node -> assertThat(node.dependents()).containsExactly("b"));
        assertThat(engine.getNode("b")).isPresent();
    }

    // ========== Dependency wait ==========

    @Test
    @DisplayName("a unit waiting on dependencies does not hold a worker slot")
    void waitingUnit_shouldNotBlockWorker() throws Exception {
        engine.close();
        engine = newEngine(1);

        CompletableFuture<JsonNode> b = engine.scheduleTask("b", token -> IntNode.valueOf(2),
            ScheduleOptions.dependsOn(List.of("a")));
        CompletableFuture<JsonNode> a = engine.scheduleTask("a", token -> IntNode.valueOf(1), null);

        assertThat(a.get(5, TimeUnit.SECONDS).asInt()).isEqualTo(1);
        assertThat(b.get(5, TimeUnit.SECONDS).asInt()).isEqualTo(2);
    }

    @Test
    void alreadyCompletedDependency_shouldBeSatisfiedImmediately() throws Exception {
        taskManager.ensureTask("prepared", "prepared");
        taskManager.completeTask("prepared", null);

        CompletableFuture<JsonNode> unit = engine.scheduleTask("next", token -> IntNode.valueOf(7),
            ScheduleOptions.dependsOn(List.of("prepared")));

        assertThat(unit.get(5, TimeUnit.SECONDS).asInt()).isEqualTo(7);
    }

    @Test
    void dependencyWait_shouldTimeOut() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("orphan", token -> {
            calls.incrementAndGet();
            return null;
        }, ScheduleOptions.dependsOn(List.of("never-scheduled")).withDependencyTimeout(Duration.ofMillis(200)));

        assertThat(failureOf(unit)).isInstanceOf(DependencyTimeoutException.class)
            .hasMessageContaining("never-scheduled");
        assertThat(calls).hasValue(0);
        assertThat(taskManager.getTask("orphan").status()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void addDependency_shouldApplyToLaterSchedule() throws Exception {
        engine.addDependency("report", "collect");
        List<String> order = new CopyOnWriteArrayList<>();

        CompletableFuture<JsonNode> report = engine.scheduleTask("report", token -> {
            order.add("report");
            return null;
        }, null);
        CompletableFuture<JsonNode> collect = engine.scheduleTask("collect", token -> {
            order.add("collect");
            return null;
        }, null);

        CompletableFuture.allOf(report, collect).get(5, TimeUnit.SECONDS);
        assertThat(order).containsExactly("collect", "report");
    }

    // ========== Retry ==========

    @Test
    void retryableFailure_shouldBeRetriedWithBackoff() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        List<Event> retrying = new CopyOnWriteArrayList<>();
        bus.subscribe(EventNames.UNIT_RETRYING, retrying::add);
        long start = System.nanoTime();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("flaky", token -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
            return IntNode.valueOf(42);
        }, ScheduleOptions.defaults().withRetries(2));

        assertThat(unit.get(5, TimeUnit.SECONDS).asInt()).isEqualTo(42);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(attempts).hasValue(3);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(150);
        assertThat(retrying).extracting(e -> e.payload().get("delayMs").asLong()).containsExactly(50L, 100L);
        assertThat(taskManager.getTask("flaky").status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void exhaustedRetries_shouldSurfaceFinalError() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("doomed", token -> {
            throw new IllegalStateException("attempt " + attempts.incrementAndGet());
        }, ScheduleOptions.defaults().withRetries(2));

        assertThat(failureOf(unit)).hasMessage("attempt 3");
        assertThat(attempts).hasValue(3);
        assertThat(taskManager.getTask("doomed").error()).isEqualTo("attempt 3");
    }

    @Test
    void permanentFailure_shouldNotBeRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("bad-input", token -> {
            attempts.incrementAndGet();
            throw ToolException.permanent("BAD_INPUT", "no such file");
        }, ScheduleOptions.defaults().withRetries(3));

        assertThat(failureOf(unit)).isInstanceOf(ToolException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void toolRunnerUnit_shouldRetryHandlerFailure() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ToolRegistry tools = new ToolRegistry().register("fetch", (args, context, hooks) -> {
            if (calls.incrementAndGet() == 1) {
                throw new ToolException("NETWORK", "reset by peer");
            }
            return mapper.createObjectNode().put("status", 200);
        });
        InMemoryToolRunRepository runs = new InMemoryToolRunRepository();
        ToolRunner runner = ToolRunner.builder(tools).eventBus(bus).toolRunRepository(runs).build();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("fetch-page",
            runner.unit("fetch", mapper.createObjectNode(), mapper.createObjectNode()),
            ScheduleOptions.defaults().withRetries(1));

        assertThat(unit.get(5, TimeUnit.SECONDS).get("status").asInt()).isEqualTo(200);
        assertThat(runs.findByToolName("fetch")).extracting(r -> r.isSuccess()).containsExactly(false, true);
    }

    @Test
    void validationRejection_shouldNotBeRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ToolRegistry tools = new ToolRegistry().register("apply_patch", (args, context, hooks) -> {
            calls.incrementAndGet();
            return null;
        });
        ToolRunner runner = ToolRunner.builder(tools)
            .validator((tool, args, context) -> ValidationResult.reject("no patch"))
            .build();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("patch",
            runner.unit("apply_patch", mapper.createObjectNode(), null),
            ScheduleOptions.defaults().withRetries(3));

        assertThat(failureOf(unit)).isInstanceOf(ValidationRejectedException.class);
        assertThat(calls).hasValue(0);
    }

    // ========== Concurrency ==========

    @Test
    void executingUnits_shouldNotExceedConcurrency() throws Exception {
        engine.close();
        engine = newEngine(2);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<WorkflowStep> steps = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            steps.add(WorkflowStep.of("u" + i, token -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(100);
                running.decrementAndGet();
                return null;
            }));
        }

        List<UnitOutcome> outcomes = engine.runGraph(steps);

        assertThat(outcomes).allMatch(UnitOutcome::fulfilled);
        assertThat(peak.get()).isEqualTo(2);
        assertThat(metrics.activeUnits()).isZero();
    }

    // ========== Cancellation ==========

    @Test
    void cancelWaitingUnit_shouldSettleCancelled() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<JsonNode> unit = engine.scheduleTask("waiting", token -> {
            calls.incrementAndGet();
            return null;
        }, ScheduleOptions.dependsOn(List.of("upstream")));

        assertThat(engine.cancel("waiting", "user abort")).isTrue();

        assertThat(failureOf(unit)).isInstanceOf(UnitCancelledException.class);
        assertThat(calls).hasValue(0);
        assertThat(taskManager.getTask("waiting").status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(taskManager.getTask("waiting").error()).isEqualTo("user abort");
    }

    @Test
    void cancelBeforeSchedule_shouldNeverRun() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        engine.cancel("skipped", "not needed");

        CompletableFuture<JsonNode> unit = engine.scheduleTask("skipped", token -> {
            calls.incrementAndGet();
            return null;
        }, null);

        assertThat(failureOf(unit)).isInstanceOf(UnitCancelledException.class);
        assertThat(calls).hasValue(0);
    }

    @Test
    void cancelledDependency_shouldFailDependent() throws Exception {
        CompletableFuture<JsonNode> upstream = engine.scheduleTask("upstream", token -> null,
            ScheduleOptions.dependsOn(List.of("never")));
        CompletableFuture<JsonNode> downstream = engine.scheduleTask("downstream", token -> null,
            ScheduleOptions.dependsOn(Set.of("upstream")));

        engine.cancel("upstream", "abort");

        assertThat(failureOf(upstream)).isInstanceOf(UnitCancelledException.class);
        assertThat(failureOf(downstream)).isInstanceOfSatisfying(DependencyFailedException.class,
            e -> assertThat(e.getDependencyId()).isEqualTo("upstream"));
    }

    @Test
    void cancelDuringAttempt_shouldStopRetries() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("stoppable", token -> {
            attempts.incrementAndGet();
            engine.cancel("stoppable", "stop");
            throw new IllegalStateException("transient");
        }, ScheduleOptions.defaults().withRetries(3));

        assertThat(failureOf(unit)).isInstanceOf(UnitCancelledException.class);
        assertThat(attempts).hasValue(1);
        assertThat(taskManager.getTask("stoppable").status()).isEqualTo(TaskStatus.CANCELLED);
    }

    @Test
    void handlerObservingCancellation_shouldNotBeRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<JsonNode> unit = engine.scheduleTask("polling", token -> {
            attempts.incrementAndGet();
            throw new HandlerFailureException("poll", "CANCELLED", "Cancelled: stop", false, null);
        }, ScheduleOptions.defaults().withRetries(3));

        assertThat(failureOf(unit)).isInstanceOf(HandlerFailureException.class);
        assertThat(attempts).hasValue(1);
    }

    // ========== Events ==========

    @Test
    void unitLifecycle_shouldEmitWorkflowEvents() throws Exception {
        List<String> names = new CopyOnWriteArrayList<>();
        for (String name : List.of(EventNames.UNIT_QUEUED, EventNames.UNIT_STARTED, EventNames.UNIT_COMPLETED)) {
            bus.subscribe(name, e -> names.add(e.name()));
        }

        engine.scheduleTask("observed", token -> null, null).get(5, TimeUnit.SECONDS);

        assertThat(names).containsExactly(
            EventNames.UNIT_QUEUED, EventNames.UNIT_STARTED, EventNames.UNIT_COMPLETED);
    }

    @Test
    void scheduleTask_whileAlreadyScheduled_shouldBeRejected() {
        engine.scheduleTask("dup", token -> null, ScheduleOptions.dependsOn(List.of("never")));

        assertThatThrownBy(() -> engine.scheduleTask("dup", token -> null, null))
            .isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    void scheduleTask_afterTaskSettled_shouldBeRejected() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        WorkUnit work = token -> IntNode.valueOf(calls.incrementAndGet());

        assertThat(engine.scheduleTask("once", work, null).get(5, TimeUnit.SECONDS).asInt()).isEqualTo(1);

        assertThatThrownBy(() -> engine.scheduleTask("once", work, null))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("already settled");
        assertThat(calls).hasValue(1);
        assertThat(taskManager.getTask("once").status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(taskManager.getTask("once").result().asInt()).isEqualTo(1);
    }

    @Test
    void scheduleTask_afterFailure_shouldBeRejected() throws Exception {
        CompletableFuture<JsonNode> unit = engine.scheduleTask("broken", token -> {
            throw new IllegalStateException("boom");
        }, null);
        failureOf(unit);

        assertThatThrownBy(() -> engine.scheduleTask("broken", token -> IntNode.valueOf(1), null))
            .isInstanceOf(WorkflowValidationException.class);
        assertThat(taskManager.getTask("broken").status()).isEqualTo(TaskStatus.FAILED);
        assertThat(taskManager.getTask("broken").error()).isEqualTo("boom");
    }

    @Test
    void cancel_afterSettlement_shouldReportNothingCancelled() throws Exception {
        engine.scheduleTask("finished", token -> null, null).get(5, TimeUnit.SECONDS);

        assertThat(engine.cancel("finished", "too late")).isFalse();
        assertThat(taskManager.getTask("finished").status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void runGraph_withBusyStep_shouldScheduleNothing() {
        AtomicInteger freshCalls = new AtomicInteger();
        engine.scheduleTask("busy", token -> null, ScheduleOptions.dependsOn(List.of("never")));

        assertThatThrownBy(() -> engine.runGraph(List.of(
            WorkflowStep.of("fresh", token -> {
                freshCalls.incrementAndGet();
                return null;
            }),
            WorkflowStep.of("busy", token -> null)
        ))).isInstanceOf(WorkflowValidationException.class);

        assertThat(freshCalls).hasValue(0);
        assertThat(taskManager.findTask("fresh")).isEmpty();
        assertThat(engine.getNode("fresh")).isEmpty();
    }

    @Test
    void runGraph_withSettledStep_shouldScheduleNothing() throws Exception {
        engine.scheduleTask("done", token -> null, null).get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> engine.runGraph(List.of(
            WorkflowStep.of("later", token -> null, "done"),
            WorkflowStep.of("done", token -> null)
        ))).isInstanceOf(WorkflowValidationException.class);

        assertThat(taskManager.findTask("later")).isEmpty();
    }

    // ========== Bookkeeping ==========

    @Test
    void settledGraph_shouldLeaveNoUnitsOrSignals() throws Exception {
        List<UnitOutcome> outcomes = engine.runGraph(List.of(
            WorkflowStep.of("a", token -> IntNode.valueOf(1)),
            WorkflowStep.of("b", token -> IntNode.valueOf(2), "a"),
            WorkflowStep.of("c", token -> {
                throw new IllegalStateException("x");
            }, "a"),
            WorkflowStep.of("d", token -> null, "b", "c")
        ));

        assertThat(outcomes).extracting(UnitOutcome::fulfilled).containsExactly(true, true, false, false);
        assertThat(engine.activeUnitCount()).isZero();
        assertThat(engine.pendingSignalCount()).isZero();
    }

    @Test
    void unitThrowingError_shouldSettleFailed() throws Exception {
        CompletableFuture<JsonNode> unit = engine.scheduleTask("fatal", token -> {
            throw new AssertionError("invariant broken");
        }, ScheduleOptions.defaults().withRetries(2));

        assertThat(failureOf(unit)).isInstanceOf(AssertionError.class).hasMessage("invariant broken");
        assertThat(taskManager.getTask("fatal").status()).isEqualTo(TaskStatus.FAILED);
        assertThat(engine.activeUnitCount()).isZero();
    }

    @Test
    void cancelledUnit_shouldBeReleased() throws Exception {
        CompletableFuture<JsonNode> unit = engine.scheduleTask("dropped", token -> null,
            ScheduleOptions.dependsOn(List.of("upstream")));

        engine.cancel("dropped", "abort");
        failureOf(unit);

        assertThat(engine.activeUnitCount()).isZero();
    }
}
