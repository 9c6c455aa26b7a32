package com.toolflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.toolflow.core.exception.NotFoundException;
import com.toolflow.core.model.Step;
import com.toolflow.core.model.Task;
import com.toolflow.core.model.TaskStatus;
import com.toolflow.core.model.WorkflowNode;
import com.toolflow.engine.task.TaskManager;
import com.toolflow.engine.workflow.WorkflowEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Read-only REST API over tracked tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskManager taskManager;
    private final WorkflowEngine workflowEngine;

    public TaskController(TaskManager taskManager, WorkflowEngine workflowEngine) {
        this.taskManager = taskManager;
        this.workflowEngine = workflowEngine;
    }

    /**
     * List tasks, oldest first, optionally filtered by status.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks(
            @RequestParam(required = false) String status) {

        TaskStatus filter = status != null ? TaskStatus.fromWireName(status) : null;
        List<TaskResponse> responses = taskManager.listTasks().stream()
            .filter(task -> filter == null || task.status() == filter)
            .map(TaskResponse::from)
            .toList();

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskManager.getTask(taskId)));
    }

    @GetMapping("/{taskId}/steps")
    public ResponseEntity<List<Step>> getSteps(@PathVariable String taskId) {
        return ResponseEntity.ok(taskManager.getTask(taskId).steps());
    }

    /**
     * Dependency edges recorded for the task's workflow unit.
     */
    @GetMapping("/{taskId}/graph")
    public ResponseEntity<WorkflowNode> getGraphNode(@PathVariable String taskId) {
        WorkflowNode node = workflowEngine.getNode(taskId)
            .orElseThrow(() -> new NotFoundException("WorkflowNode", taskId));
        return ResponseEntity.ok(node);
    }

    // ========== DTOs ==========

    public record TaskResponse(
        String id,
        String parent,
        String title,
        TaskStatus status,
        int stepCount,
        List<Step> steps,
        JsonNode meta,
        JsonNode result,
        String error,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static TaskResponse from(Task task) {
            return new TaskResponse(
                task.id(),
                task.parent(),
                task.title(),
                task.status(),
                task.steps().size(),
                task.steps(),
                task.meta(),
                task.result(),
                task.error(),
                task.createdAt(),
                task.updatedAt()
            );
        }
    }
}
