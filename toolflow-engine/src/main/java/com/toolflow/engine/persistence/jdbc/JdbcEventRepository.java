package com.toolflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.core.model.Event;
import com.toolflow.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * JDBC-backed append-only event log ordered by bus sequence.
 */
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Event> rowMapper = this::mapRow;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public void append(Event event) {
        String sql = """
            INSERT INTO events (id, seq, name, payload, event_timestamp)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            event.id().toString(),
            event.sequence(),
            event.name(),
            json.write(event.payload()),
            JsonColumns.instant(event.timestamp())
        );
        if (rows == 0) {
            log.debug("Event {} already stored, skipped", event.id());
        }
    }

    @Override
    public List<Event> findByName(String name) {
        String sql = """
            SELECT * FROM events
            WHERE name = ?
            ORDER BY seq ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, name);
    }

    @Override
    public List<Event> findFrom(long fromSequence, int limit) {
        String sql = """
            SELECT * FROM events
            WHERE seq >= ?
            ORDER BY seq ASC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, fromSequence, limit);
    }

    @Override
    public long lastSequence() {
        Long last = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(seq), 0) FROM events", Long.class);
        return last != null ? last : 0;
    }

    private Event mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Event(
            UUID.fromString(rs.getString("id")),
            rs.getLong("seq"),
            rs.getString("name"),
            json.readNode(rs.getString("payload")),
            JsonColumns.instant(rs.getString("event_timestamp"))
        );
    }
}
