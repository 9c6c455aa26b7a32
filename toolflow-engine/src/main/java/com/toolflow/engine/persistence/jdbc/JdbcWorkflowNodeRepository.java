package com.toolflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.model.WorkflowNode;
import com.toolflow.core.repository.WorkflowNodeRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * JDBC-backed store of workflow graph node snapshots.
 */
public class JdbcWorkflowNodeRepository implements WorkflowNodeRepository {

    private static final TypeReference<Set<String>> ID_SET = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<WorkflowNode> rowMapper = this::mapRow;

    public JdbcWorkflowNodeRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public void save(WorkflowNode node) {
        String sql = """
            INSERT INTO workflow_nodes (id, deps, dependents, created_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (id) DO UPDATE SET
                deps = excluded.deps,
                dependents = excluded.dependents
            """;

        jdbcTemplate.update(sql,
            node.id(),
            json.write(new TreeSet<>(node.deps())),
            json.write(new TreeSet<>(node.dependents())),
            JsonColumns.instant(node.createdAt())
        );
    }

    @Override
    public Optional<WorkflowNode> findById(String id) {
        List<WorkflowNode> results = jdbcTemplate.query("SELECT * FROM workflow_nodes WHERE id = ?", rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private WorkflowNode mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new WorkflowNode(
            rs.getString("id"),
            json.read(rs.getString("deps"), ID_SET, Set.of()),
            json.read(rs.getString("dependents"), ID_SET, Set.of()),
            JsonColumns.instant(rs.getString("created_at"))
        );
    }
}
