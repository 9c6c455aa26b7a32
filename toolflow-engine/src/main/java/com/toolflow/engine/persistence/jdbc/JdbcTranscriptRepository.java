package com.toolflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.model.ToolTranscript;
import com.toolflow.core.repository.TranscriptRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * JDBC-backed store of tool call transcripts.
 */
public class JdbcTranscriptRepository implements TranscriptRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<ToolTranscript> rowMapper = this::mapRow;

    public JdbcTranscriptRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public void save(ToolTranscript transcript) {
        String sql = """
            INSERT INTO tool_transcripts (run_id, tool_name, args, outcome, recorded_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (run_id) DO NOTHING
            """;

        jdbcTemplate.update(sql,
            transcript.runId(),
            transcript.toolName(),
            json.write(transcript.args()),
            json.write(transcript.outcome()),
            JsonColumns.instant(transcript.timestamp())
        );
    }

    @Override
    public List<ToolTranscript> findRecent(String toolName, int limit) {
        String sql = """
            SELECT * FROM tool_transcripts
            WHERE tool_name = ?
            ORDER BY recorded_at DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, toolName, limit);
    }

    private ToolTranscript mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new ToolTranscript(
            rs.getString("run_id"),
            rs.getString("tool_name"),
            json.readNode(rs.getString("args")),
            json.readNode(rs.getString("outcome")),
            JsonColumns.instant(rs.getString("recorded_at"))
        );
    }
}
