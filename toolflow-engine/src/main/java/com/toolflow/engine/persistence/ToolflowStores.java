package com.toolflow.engine.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.repository.EventRepository;
import com.toolflow.core.repository.TaskRepository;
import com.toolflow.core.repository.ToolRunRepository;
import com.toolflow.core.repository.TranscriptRepository;
import com.toolflow.core.repository.WorkflowNodeRepository;
import com.toolflow.engine.persistence.jdbc.JdbcEventRepository;
import com.toolflow.engine.persistence.jdbc.JdbcTaskRepository;
import com.toolflow.engine.persistence.jdbc.JdbcToolRunRepository;
import com.toolflow.engine.persistence.jdbc.JdbcTranscriptRepository;
import com.toolflow.engine.persistence.jdbc.JdbcWorkflowNodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * The set of repositories backing one engine instance.
 */
public record ToolflowStores(
    TaskRepository tasks,
    ToolRunRepository toolRuns,
    EventRepository events,
    WorkflowNodeRepository workflowNodes,
    TranscriptRepository transcripts
) {
    private static final Logger log = LoggerFactory.getLogger(ToolflowStores.class);

    public static final String SCHEMA_LOCATION = "db/schema.sql";

    public static ToolflowStores inMemory() {
        return new ToolflowStores(
            new InMemoryTaskRepository(),
            new InMemoryToolRunRepository(),
            new InMemoryEventRepository(),
            new InMemoryWorkflowNodeRepository(),
            new InMemoryTranscriptRepository()
        );
    }

    /**
     * JDBC repositories over the given data source. Creates missing tables first.
     */
    public static ToolflowStores jdbc(DataSource dataSource, ObjectMapper objectMapper) {
        initializeSchema(dataSource);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        return new ToolflowStores(
            new JdbcTaskRepository(jdbcTemplate, objectMapper),
            new JdbcToolRunRepository(jdbcTemplate, objectMapper),
            new JdbcEventRepository(jdbcTemplate, objectMapper),
            new JdbcWorkflowNodeRepository(jdbcTemplate, objectMapper),
            new JdbcTranscriptRepository(jdbcTemplate, objectMapper)
        );
    }

    public static void initializeSchema(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.execute(dataSource);
        log.info("Initialized schema from {}", SCHEMA_LOCATION);
    }
}
