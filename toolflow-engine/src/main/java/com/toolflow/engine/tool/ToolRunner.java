package com.toolflow.engine.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.toolflow.core.exception.HandlerFailureException;
import com.toolflow.core.exception.UnknownToolException;
import com.toolflow.core.exception.ValidationRejectedException;
import com.toolflow.core.json.ObjectMappers;
import com.toolflow.core.model.EventNames;
import com.toolflow.core.model.Step;
import com.toolflow.core.model.ToolRun;
import com.toolflow.core.model.ToolTranscript;
import com.toolflow.core.repository.ToolRunRepository;
import com.toolflow.core.repository.TranscriptRepository;
import com.toolflow.engine.event.EventBus;
import com.toolflow.engine.logging.LoggingContext;
import com.toolflow.engine.metrics.ToolflowMetrics;
import com.toolflow.engine.task.TaskManager;
import com.toolflow.engine.workflow.WorkUnit;
import com.toolflow.oracle.Rectifier;
import com.toolflow.oracle.ValidationResult;
import com.toolflow.oracle.Validator;
import com.toolflow.worker.CancellationToken;
import com.toolflow.worker.ToolException;
import com.toolflow.worker.ToolHandler;
import com.toolflow.worker.ToolHooks;
import com.toolflow.worker.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes one named tool call: validate, optionally rectify, run the handler once, record.
 *
 * The handler is never retried here; retries belong to the workflow engine. Handler
 * failures and unresolved rejections reach the caller. Failures writing the run record,
 * the transcript or the caller task's step are logged and dropped.
 *
 * Every collaborator except the tool registry is optional.
 */
public class ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ToolRunner.class);

    private final ToolRegistry tools;
    private final Validator validator;
    private final Rectifier rectifier;
    private final EventBus eventBus;
    private final TaskManager taskManager;
    private final ToolRunRepository toolRunRepository;
    private final TranscriptRepository transcriptRepository;
    private final ToolflowMetrics metrics;
    private final ObjectMapper objectMapper;

    private ToolRunner(Builder builder) {
        this.tools = builder.tools;
        this.validator = builder.validator;
        this.rectifier = builder.rectifier;
        this.eventBus = builder.eventBus;
        this.taskManager = builder.taskManager;
        this.toolRunRepository = builder.toolRunRepository;
        this.transcriptRepository = builder.transcriptRepository;
        this.metrics = builder.metrics != null ? builder.metrics : ToolflowMetrics.detached();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : ObjectMappers.create();
    }

    public static Builder builder(ToolRegistry tools) {
        return new Builder(tools);
    }

    public JsonNode call(String toolName, JsonNode args, JsonNode context) {
        return call(toolName, args, context, new CancellationToken());
    }

    /**
     * Run a tool call to completion.
     *
     * @param toolName registered tool name
     * @param args proposed arguments
     * @param context caller context; a textual {@code taskId} links the call to a task step
     * @param cancellation token exposed to the handler through {@link ToolHooks#cancellation()}
     * @return the handler's result
     * @throws UnknownToolException if no handler is registered under the name
     * @throws ValidationRejectedException if the call was rejected and not rectified
     * @throws HandlerFailureException if the handler failed
     */
    public JsonNode call(String toolName, JsonNode args, JsonNode context, CancellationToken cancellation) {
        ToolHandler handler = tools.find(toolName)
            .orElseThrow(() -> new UnknownToolException(toolName));

        JsonNode callContext = context != null ? context : objectMapper.createObjectNode();
        JsonNode callArgs = args != null ? args : objectMapper.createObjectNode();
        String runId = UUID.randomUUID().toString();
        String taskId = textOrNull(callContext.get("taskId"));

        try (LoggingContext ignored = LoggingContext.forTool(toolName, runId, taskId)) {
            String stepId = trackStepStart(taskId, toolName, runId);

            boolean rectified = false;
            if (validator != null) {
                ValidationResult verdict = validator.check(toolName, callArgs, callContext);
                if (!verdict.accepted()) {
                    Optional<JsonNode> proposal = rectify(runId, toolName, callArgs, callContext, verdict.reason());
                    if (proposal.isEmpty()) {
                        ValidationRejectedException rejected =
                            new ValidationRejectedException(toolName, verdict.reason(), rectifier != null);
                        trackStepFailure(taskId, stepId, rejected.getMessage());
                        throw rejected;
                    }
                    callArgs = proposal.get();
                    rectified = true;
                }
            }

            return execute(handler, runId, toolName, callArgs, callContext, cancellation, rectified, taskId, stepId);
        }
    }

    /**
     * Wrap a tool call as a schedulable unit sharing the unit's cancellation token.
     */
    public WorkUnit unit(String toolName, JsonNode args, JsonNode context) {
        return cancellation -> call(toolName, args, context, cancellation);
    }

    private Optional<JsonNode> rectify(String runId, String toolName, JsonNode args, JsonNode context, String reason) {
        log.info("Tool call {} rejected: {}", toolName, reason);
        metrics.toolRejected(toolName);
        emit(EventNames.TOOL_REJECTED, payload(runId, toolName, "args", args, "reason", reason));

        if (rectifier == null) {
            return Optional.empty();
        }
        Optional<JsonNode> proposal = rectifier.propose(toolName, args, context, reason)
            .filter(p -> !p.isNull() && !p.isMissingNode());
        if (proposal.isPresent()) {
            log.info("Tool call {} rectified", toolName);
            metrics.toolRectified(toolName);
            emit(EventNames.TOOL_RECTIFIED, payload(runId, toolName, "args", proposal.get(), "originalArgs", args));
        } else {
            log.info("Rectifier had no proposal for {}", toolName);
        }
        return proposal;
    }

    private JsonNode execute(ToolHandler handler, String runId, String toolName, JsonNode args, JsonNode context,
                             CancellationToken cancellation, boolean rectified, String taskId, String stepId) {
        Instant startedAt = Instant.now();
        emit(EventNames.TOOL_START, payload(runId, toolName, "args", args, "rectified", rectified));

        JsonNode result;
        try {
            result = handler.execute(args, context, new RunHooks(runId, toolName, cancellation));
        } catch (ToolException e) {
            throw recordFailure(runId, toolName, args, context, startedAt, rectified, taskId, stepId,
                e.getErrorCode(), describe(e), e.isRetryable(), e);
        } catch (RuntimeException e) {
            throw recordFailure(runId, toolName, args, context, startedAt, rectified, taskId, stepId,
                HandlerFailureException.ERROR_CODE, describe(e), true, e);
        } catch (Error e) {
            // recorded like any failure, then propagated unwrapped
            recordFailure(runId, toolName, args, context, startedAt, rectified, taskId, stepId,
                HandlerFailureException.ERROR_CODE, describe(e), false, e);
            throw e;
        }

        Instant finishedAt = Instant.now();
        ToolRun run = ToolRun.succeeded(runId, toolName, args, result, startedAt, finishedAt,
            contextMeta(context), rectified, taskId);
        persist(run);
        saveTranscript(run, result);
        metrics.toolSucceeded(toolName, Duration.ofMillis(run.durationMs()));
        emit(EventNames.TOOL_END, run);
        log.debug("Tool {} finished in {} ms", toolName, run.durationMs());

        trackStepSuccess(taskId, stepId, result);
        return result;
    }

    private HandlerFailureException recordFailure(String runId, String toolName, JsonNode args, JsonNode context,
                                                  Instant startedAt, boolean rectified, String taskId, String stepId,
                                                  String errorCode, String message, boolean retryable, Throwable cause) {
        Instant finishedAt = Instant.now();
        ToolRun run = ToolRun.failed(runId, toolName, args, message, startedAt, finishedAt,
            contextMeta(context), rectified, taskId);
        persist(run);
        saveTranscript(run, objectMapper.createObjectNode().put("error", message));
        metrics.toolFailed(toolName, Duration.ofMillis(run.durationMs()));
        emit(EventNames.TOOL_ERROR, run);
        log.warn("Tool {} failed [{}]: {}", toolName, errorCode, message);

        trackStepFailure(taskId, stepId, message);
        return new HandlerFailureException(toolName, errorCode, message, retryable, cause);
    }

    // ========== Audit trail ==========

    private void persist(ToolRun run) {
        if (toolRunRepository == null) {
            return;
        }
        try {
            toolRunRepository.save(run);
        } catch (Exception e) {
            log.error("Failed to persist tool run {}: {}", run.id(), e.getMessage());
        }
    }

    private void saveTranscript(ToolRun run, JsonNode outcome) {
        if (transcriptRepository == null) {
            return;
        }
        try {
            transcriptRepository.save(new ToolTranscript(run.id(), run.toolName(), run.args(),
                outcome != null ? outcome : NullNode.getInstance(), run.finishedAt()));
        } catch (Exception e) {
            log.error("Failed to save transcript for tool run {}: {}", run.id(), e.getMessage());
        }
    }

    private void emit(String eventName, Object payload) {
        if (eventBus != null) {
            eventBus.emit(eventName, payload);
        }
    }

    // ========== Caller task steps ==========

    private String trackStepStart(String taskId, String toolName, String runId) {
        if (taskManager == null || taskManager.findTask(taskId).isEmpty()) {
            return null;
        }
        try {
            ObjectNode meta = objectMapper.createObjectNode()
                .put("toolName", toolName)
                .put("toolRunId", runId);
            Step step = taskManager.addStep(taskId, "tool:" + toolName, meta);
            taskManager.startStep(taskId, step.id());
            return step.id();
        } catch (RuntimeException e) {
            log.warn("Failed to record tool step on task {}: {}", taskId, e.getMessage());
            return null;
        }
    }

    private void trackStepSuccess(String taskId, String stepId, JsonNode result) {
        if (stepId == null) {
            return;
        }
        try {
            taskManager.completeStep(taskId, stepId, result);
        } catch (RuntimeException e) {
            log.warn("Failed to complete tool step {} on task {}: {}", stepId, taskId, e.getMessage());
        }
    }

    private void trackStepFailure(String taskId, String stepId, String error) {
        if (stepId == null) {
            return;
        }
        try {
            taskManager.failStep(taskId, stepId, error);
        } catch (RuntimeException e) {
            log.warn("Failed to fail tool step {} on task {}: {}", stepId, taskId, e.getMessage());
        }
    }

    // ========== Helpers ==========

    private JsonNode contextMeta(JsonNode context) {
        ObjectNode meta = objectMapper.createObjectNode();
        JsonNode projectRoot = context.get("projectRoot");
        meta.set("projectRoot", projectRoot != null ? projectRoot : NullNode.getInstance());
        return meta;
    }

    private static Map<String, Object> payload(String runId, String toolName, String key, Object value,
                                               String key2, Object value2) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", runId);
        payload.put("toolName", toolName);
        payload.put(key, value);
        payload.put(key2, value2);
        payload.put("timestamp", Instant.now());
        return payload;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /**
     * Hooks handed to one handler invocation. Log lines become async {@code tool.log} events.
     */
    private class RunHooks implements ToolHooks {
        private final String runId;
        private final String toolName;
        private final CancellationToken cancellation;

        RunHooks(String runId, String toolName, CancellationToken cancellation) {
            this.runId = runId;
            this.toolName = toolName;
            this.cancellation = cancellation != null ? cancellation : new CancellationToken();
        }

        @Override
        public void onLog(String message) {
            if (eventBus == null) {
                return;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("id", runId);
            payload.put("toolName", toolName);
            payload.put("log", message);
            payload.put("timestamp", Instant.now());
            eventBus.emitAsync(EventNames.TOOL_LOG, payload);
        }

        @Override
        public CancellationToken cancellation() {
            return cancellation;
        }
    }

    public static class Builder {
        private final ToolRegistry tools;
        private Validator validator;
        private Rectifier rectifier;
        private EventBus eventBus;
        private TaskManager taskManager;
        private ToolRunRepository toolRunRepository;
        private TranscriptRepository transcriptRepository;
        private ToolflowMetrics metrics;
        private ObjectMapper objectMapper;

        private Builder(ToolRegistry tools) {
            if (tools == null) {
                throw new IllegalArgumentException("Tool registry is required");
            }
            this.tools = tools;
        }

        public Builder validator(Validator validator) {
            this.validator = validator;
            return this;
        }

        public Builder rectifier(Rectifier rectifier) {
            this.rectifier = rectifier;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder taskManager(TaskManager taskManager) {
            this.taskManager = taskManager;
            return this;
        }

        public Builder toolRunRepository(ToolRunRepository toolRunRepository) {
            this.toolRunRepository = toolRunRepository;
            return this;
        }

        public Builder transcriptRepository(TranscriptRepository transcriptRepository) {
            this.transcriptRepository = transcriptRepository;
            return this;
        }

        public Builder metrics(ToolflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public ToolRunner build() {
            return new ToolRunner(this);
        }
    }
}
