package com.aicmd.cache.repository;

import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class FeedbackEventRepository {

    public int append(JdbcTemplate jdbcTemplate, String queryHash, String command, FeedbackAction action, Instant timestamp) {
        return jdbcTemplate.update(
            "INSERT INTO feedback_event (query_hash, command, action, created_at) VALUES (?, ?, ?, ?)",
            queryHash,
            command,
            action.dbValue(),
            timestamp.toEpochMilli()
        );
    }

    public List<FeedbackEvent> listByHash(JdbcTemplate jdbcTemplate, String queryHash) {
        return jdbcTemplate.query(
            "SELECT id, query_hash, command, action, created_at FROM feedback_event "
                + "WHERE query_hash = ? ORDER BY created_at ASC, id ASC",
            (rs, rowNum) -> new FeedbackEvent(
                rs.getLong("id"),
                rs.getString("query_hash"),
                rs.getString("command"),
                FeedbackAction.fromDbValue(rs.getString("action")),
                Instant.ofEpochMilli(rs.getLong("created_at"))
            ),
            queryHash
        );
    }

    public long count(JdbcTemplate jdbcTemplate) {
        Long value = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM feedback_event", Long.class);
        return value == null ? 0L : value;
    }
}
