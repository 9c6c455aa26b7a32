package com.toolflow.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.exception.ValidationRejectedException;
import com.toolflow.core.model.TaskStatus;
import com.toolflow.core.repository.TaskRepository;
import com.toolflow.engine.persistence.InMemoryTaskRepository;
import com.toolflow.engine.persistence.jdbc.JdbcTaskRepository;
import com.toolflow.engine.task.TaskManager;
import com.toolflow.engine.tool.ToolRunner;
import com.toolflow.engine.workflow.WorkflowEngine;
import com.toolflow.oracle.OracleFailurePolicy;
import com.toolflow.worker.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ToolflowConfigurationTest {

    @TempDir
    Path tempDir;

    private static AnnotationConfigApplicationContext context(Map<String, Object> properties) {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(new MapPropertySource("test", properties));
        context.setEnvironment(environment);
        context.register(ToolflowConfiguration.class);
        context.refresh();
        return context;
    }

    @Test
    void defaults_shouldWireInMemoryEngine() throws Exception {
        try (AnnotationConfigApplicationContext context = context(Map.of())) {
            ToolflowProperties properties = context.getBean(ToolflowProperties.class);
            assertThat(properties).isEqualTo(ToolflowProperties.defaults());
            assertThat(context.getBean(TaskRepository.class)).isInstanceOf(InMemoryTaskRepository.class);

            ObjectMapper mapper = context.getBean(ObjectMapper.class);
            context.getBean(ToolRegistry.class).register("echo", (args, ctx, hooks) -> args);
            WorkflowEngine engine = context.getBean(WorkflowEngine.class);
            ToolRunner runner = context.getBean(ToolRunner.class);

            var result = engine.scheduleTask("echo-unit",
                runner.unit("echo", mapper.createObjectNode().put("text", "hi"), null), null)
                .get(5, TimeUnit.SECONDS);

            assertThat(result.get("text").asText()).isEqualTo("hi");
            assertThat(context.getBean(TaskManager.class).getTask("echo-unit").status())
                .isEqualTo(TaskStatus.COMPLETED);
        }
    }

    @Test
    void defaultValidator_shouldRejectPatchWithoutPatchField() {
        try (AnnotationConfigApplicationContext context = context(Map.of())) {
            ObjectMapper mapper = context.getBean(ObjectMapper.class);
            context.getBean(ToolRegistry.class).register("apply_patch", (args, ctx, hooks) -> args);

            assertThatThrownBy(() -> context.getBean(ToolRunner.class)
                .call("apply_patch", mapper.createObjectNode(), null))
                .isInstanceOf(ValidationRejectedException.class)
                .hasMessageContaining("patch");
        }
    }

    @Test
    void properties_shouldBeReadFromEnvironment() {
        Map<String, Object> values = Map.of(
            "toolflow.concurrency", "5",
            "toolflow.retry.base-backoff-ms", "50",
            "toolflow.retry.default-retries", "2",
            "toolflow.dependency-timeout-ms", "1000",
            "toolflow.oracle.failure-policy", "fail-closed");

        try (AnnotationConfigApplicationContext context = context(values)) {
            ToolflowProperties properties = context.getBean(ToolflowProperties.class);

            assertThat(properties.concurrency()).isEqualTo(5);
            assertThat(properties.baseBackoff()).isEqualTo(Duration.ofMillis(50));
            assertThat(properties.dependencyTimeout()).isEqualTo(Duration.ofSeconds(1));
            assertThat(properties.oracleFailurePolicy()).isEqualTo(OracleFailurePolicy.FAIL_CLOSED);
            assertThat(properties.retryPolicy().maxAttempts()).isEqualTo(3);
            assertThat(properties.retryPolicy().computeBackoff(2)).isEqualTo(Duration.ofMillis(100));
        }
    }

    @Test
    void jdbcStorage_shouldPersistAcrossContexts() {
        Map<String, Object> values = Map.of(
            "toolflow.storage", "jdbc",
            "toolflow.jdbc.url", "jdbc:sqlite:" + tempDir.resolve("engine.db"));

        String taskId;
        try (AnnotationConfigApplicationContext context = context(values)) {
            assertThat(context.getBean(TaskRepository.class)).isInstanceOf(JdbcTaskRepository.class);
            TaskManager tasks = context.getBean(TaskManager.class);
            taskId = tasks.createTask("persisted", null, null).id();
            tasks.completeTask(taskId, null);
        }

        try (AnnotationConfigApplicationContext context = context(values)) {
            assertThat(context.getBean(TaskManager.class).getTask(taskId).status())
                .isEqualTo(TaskStatus.COMPLETED);
        }
    }

    @Test
    void invalidSettings_shouldBeRejected() {
        assertThatThrownBy(() -> new ToolflowProperties(0, Duration.ZERO, Duration.ZERO, 0,
            Duration.ofSeconds(1), OracleFailurePolicy.FAIL_OPEN, ToolflowProperties.Storage.MEMORY, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new ToolflowProperties(1, Duration.ZERO, Duration.ZERO, 0,
            Duration.ofSeconds(1), OracleFailurePolicy.FAIL_OPEN, ToolflowProperties.Storage.JDBC, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jdbc.url");
    }
}
