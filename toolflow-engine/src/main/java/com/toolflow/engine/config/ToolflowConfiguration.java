package com.toolflow.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.json.ObjectMappers;
import com.toolflow.core.repository.EventRepository;
import com.toolflow.core.repository.TaskRepository;
import com.toolflow.core.repository.ToolRunRepository;
import com.toolflow.core.repository.TranscriptRepository;
import com.toolflow.engine.event.EventBus;
import com.toolflow.engine.metrics.ToolflowMetrics;
import com.toolflow.engine.persistence.ToolflowStores;
import com.toolflow.engine.task.TaskManager;
import com.toolflow.engine.tool.ToolRunner;
import com.toolflow.engine.workflow.WorkflowEngine;
import com.toolflow.oracle.OracleRectifier;
import com.toolflow.oracle.PolicyValidator;
import com.toolflow.oracle.ReasoningOracle;
import com.toolflow.oracle.Validator;
import com.toolflow.oracle.rule.ValidationRules;
import com.toolflow.worker.ToolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Wires the engine components.
 *
 * Applications contribute tools by registering handlers on the {@link ToolRegistry} bean,
 * and may supply a {@link ReasoningOracle} bean to enable oracle validation and rectification.
 */
@Configuration
public class ToolflowConfiguration implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ToolflowConfiguration.class);

    private SingleConnectionDataSource dataSource;

    @Bean
    public ToolflowProperties toolflowProperties(Environment environment) {
        ToolflowProperties properties = ToolflowProperties.from(environment);
        log.info("Toolflow settings: concurrency={}, storage={}, oracle policy={}",
            properties.concurrency(), properties.storage(), properties.oracleFailurePolicy());
        return properties;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMappers.create();
    }

    @Bean
    public ToolflowMetrics toolflowMetrics(ObjectProvider<MeterRegistry> registries) {
        MeterRegistry registry = registries.getIfAvailable(SimpleMeterRegistry::new);
        registry.config().commonTags("application", "toolflow");
        return new ToolflowMetrics(registry);
    }

    @Bean
    public ToolflowStores toolflowStores(ToolflowProperties properties, ObjectMapper objectMapper) {
        if (properties.storage() == ToolflowProperties.Storage.JDBC) {
            log.info("Using JDBC storage at {}", properties.jdbcUrl());
            dataSource = new SingleConnectionDataSource(properties.jdbcUrl(), true);
            return ToolflowStores.jdbc(dataSource, objectMapper);
        }
        return ToolflowStores.inMemory();
    }

    @Bean
    public TaskRepository taskRepository(ToolflowStores stores) {
        return stores.tasks();
    }

    @Bean
    public ToolRunRepository toolRunRepository(ToolflowStores stores) {
        return stores.toolRuns();
    }

    @Bean
    public EventRepository eventRepository(ToolflowStores stores) {
        return stores.events();
    }

    @Bean
    public TranscriptRepository transcriptRepository(ToolflowStores stores) {
        return stores.transcripts();
    }

    @Bean
    public EventBus eventBus(EventRepository eventRepository, ObjectMapper objectMapper) {
        return new EventBus(eventRepository, objectMapper);
    }

    @Bean
    public TaskManager taskManager(TaskRepository taskRepository, EventBus eventBus) {
        TaskManager taskManager = new TaskManager(taskRepository, eventBus);
        taskManager.hydrate();
        return taskManager;
    }

    @Bean
    public ToolRegistry toolRegistry() {
        return new ToolRegistry();
    }

    @Bean
    public Validator toolValidator(ToolflowProperties properties, ObjectProvider<ReasoningOracle> oracle,
                                   ObjectMapper objectMapper) {
        return new PolicyValidator(ValidationRules.defaults(), oracle.getIfAvailable(),
            properties.oracleFailurePolicy(), objectMapper);
    }

    @Bean
    public ToolRunner toolRunner(ToolRegistry toolRegistry, Validator toolValidator,
                                 ObjectProvider<ReasoningOracle> oracle, EventBus eventBus,
                                 TaskManager taskManager, ToolflowStores stores,
                                 ToolflowMetrics toolflowMetrics, ObjectMapper objectMapper) {
        ReasoningOracle reasoningOracle = oracle.getIfAvailable();
        return ToolRunner.builder(toolRegistry)
            .validator(toolValidator)
            .rectifier(reasoningOracle != null ? new OracleRectifier(reasoningOracle, objectMapper) : null)
            .eventBus(eventBus)
            .taskManager(taskManager)
            .toolRunRepository(stores.toolRuns())
            .transcriptRepository(stores.transcripts())
            .metrics(toolflowMetrics)
            .objectMapper(objectMapper)
            .build();
    }

    @Bean
    public WorkflowEngine workflowEngine(ToolflowProperties properties, TaskManager taskManager,
                                         EventBus eventBus, ToolflowStores stores, ToolflowMetrics toolflowMetrics) {
        return new WorkflowEngine(taskManager, eventBus, stores.workflowNodes(), toolflowMetrics,
            properties.concurrency(), properties.retryPolicy(), properties.dependencyTimeout());
    }

    @Override
    public void destroy() {
        if (dataSource != null) {
            dataSource.destroy();
            log.info("Closed JDBC storage connection");
        }
    }
}
