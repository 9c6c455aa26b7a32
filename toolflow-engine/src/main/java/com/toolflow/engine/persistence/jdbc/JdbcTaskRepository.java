package com.toolflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.model.Step;
import com.toolflow.core.model.Task;
import com.toolflow.core.model.TaskStatus;
import com.toolflow.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed implementation of TaskRepository.
 * Steps are stored with their task as a JSON array.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);
    private static final TypeReference<List<Step>> STEP_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Task> rowMapper = this::mapRow;

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public void save(Task task) {
        String sql = """
            INSERT INTO tasks (
                id, parent, title, status, steps, meta, result, error, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            task.id(),
            task.parent(),
            task.title(),
            task.status().wireName(),
            json.write(task.steps()),
            json.write(task.meta()),
            json.write(task.result()),
            task.error(),
            JsonColumns.instant(task.createdAt()),
            JsonColumns.instant(task.updatedAt())
        );
        log.debug("Saved task {}", task.id());
    }

    @Override
    public void update(Task task) {
        String sql = """
            UPDATE tasks SET
                title = ?, status = ?, steps = ?, meta = ?, result = ?, error = ?, updated_at = ?
            WHERE id = ?
            """;

        int rows = jdbcTemplate.update(sql,
            task.title(),
            task.status().wireName(),
            json.write(task.steps()),
            json.write(task.meta()),
            json.write(task.result()),
            task.error(),
            JsonColumns.instant(task.updatedAt()),
            task.id()
        );
        if (rows == 0) {
            log.debug("Task {} not stored yet, inserting", task.id());
            save(task);
        }
    }

    @Override
    public Optional<Task> findById(String id) {
        List<Task> results = jdbcTemplate.query("SELECT * FROM tasks WHERE id = ?", rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Task> findAll() {
        return jdbcTemplate.query("SELECT * FROM tasks ORDER BY created_at ASC, id ASC", rowMapper);
    }

    private Task mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Task(
            rs.getString("id"),
            rs.getString("parent"),
            rs.getString("title"),
            TaskStatus.fromWireName(rs.getString("status")),
            json.read(rs.getString("steps"), STEP_LIST, List.of()),
            json.readNode(rs.getString("meta")),
            json.readNode(rs.getString("result")),
            rs.getString("error"),
            JsonColumns.instant(rs.getString("created_at")),
            JsonColumns.instant(rs.getString("updated_at"))
        );
    }
}
