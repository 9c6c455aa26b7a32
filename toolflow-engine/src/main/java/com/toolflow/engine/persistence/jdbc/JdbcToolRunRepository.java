package com.toolflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.model.ToolRun;
import com.toolflow.core.repository.ToolRunRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed implementation of ToolRunRepository. Rows are insert-only.
 */
public class JdbcToolRunRepository implements ToolRunRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<ToolRun> rowMapper = this::mapRow;

    public JdbcToolRunRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public void save(ToolRun run) {
        String sql = """
            INSERT INTO tool_runs (
                id, tool_name, args, result, error, started_at, finished_at,
                duration_ms, context_meta, rectified, task_id
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

        jdbcTemplate.update(sql,
            run.id(),
            run.toolName(),
            json.write(run.args()),
            json.write(run.result()),
            run.error(),
            JsonColumns.instant(run.startedAt()),
            JsonColumns.instant(run.finishedAt()),
            run.durationMs(),
            json.write(run.contextMeta()),
            run.rectified(),
            run.taskId()
        );
    }

    @Override
    public Optional<ToolRun> findById(String id) {
        List<ToolRun> results = jdbcTemplate.query("SELECT * FROM tool_runs WHERE id = ?", rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ToolRun> findByToolName(String toolName) {
        String sql = """
            SELECT * FROM tool_runs
            WHERE tool_name = ?
            ORDER BY started_at ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, toolName);
    }

    @Override
    public List<ToolRun> findAll() {
        return jdbcTemplate.query("SELECT * FROM tool_runs ORDER BY started_at ASC", rowMapper);
    }

    private ToolRun mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new ToolRun(
            rs.getString("id"),
            rs.getString("tool_name"),
            json.readNode(rs.getString("args")),
            json.readNode(rs.getString("result")),
            rs.getString("error"),
            JsonColumns.instant(rs.getString("started_at")),
            JsonColumns.instant(rs.getString("finished_at")),
            rs.getLong("duration_ms"),
            json.readNode(rs.getString("context_meta")),
            rs.getBoolean("rectified"),
            rs.getString("task_id")
        );
    }
}
