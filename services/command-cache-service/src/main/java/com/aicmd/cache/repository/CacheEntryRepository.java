package com.aicmd.cache.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class CacheEntryRepository {
    private static final String SELECT_FIELDS =
        "SELECT id, query_text, query_hash, command, confirmation_count, rejection_count, "
            + "confidence_score, created_at, last_used_at, os_type, shell_type "
            + "FROM command_cache ";
    private static final RowMapper<CacheEntry> ROW_MAPPER = new CacheEntryRowMapper();

    public Optional<CacheEntry> findByHash(JdbcTemplate jdbcTemplate, String queryHash) {
        List<CacheEntry> rows = jdbcTemplate.query(SELECT_FIELDS + "WHERE query_hash = ? LIMIT 1", ROW_MAPPER, queryHash);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int insert(
        JdbcTemplate jdbcTemplate,
        String queryText,
        String queryHash,
        String command,
        String osType,
        String shellType,
        Instant now
    ) {
        return jdbcTemplate.update(
            "INSERT INTO command_cache "
                + "(query_text, query_hash, command, confirmation_count, rejection_count, confidence_score, "
                + "created_at, last_used_at, os_type, shell_type) "
                + "VALUES (?, ?, ?, 0, 0, 0.0, ?, ?, ?, ?)",
            queryText,
            queryHash,
            command,
            now.toEpochMilli(),
            now.toEpochMilli(),
            osType,
            shellType
        );
    }

    public int refresh(JdbcTemplate jdbcTemplate, String queryHash, String queryText, String osType, String shellType, Instant now) {
        return jdbcTemplate.update(
            "UPDATE command_cache SET query_text = ?, os_type = ?, shell_type = ?, last_used_at = ? WHERE query_hash = ?",
            queryText,
            osType,
            shellType,
            now.toEpochMilli(),
            queryHash
        );
    }

    public int replaceCommand(
        JdbcTemplate jdbcTemplate,
        String queryHash,
        String queryText,
        String command,
        String osType,
        String shellType,
        Instant now
    ) {
        return jdbcTemplate.update(
            "UPDATE command_cache SET query_text = ?, command = ?, confirmation_count = 0, rejection_count = 0, "
                + "confidence_score = 0.0, os_type = ?, shell_type = ?, last_used_at = ? WHERE query_hash = ?",
            queryText,
            command,
            osType,
            shellType,
            now.toEpochMilli(),
            queryHash
        );
    }

    public int touch(JdbcTemplate jdbcTemplate, String queryHash, Instant now) {
        return jdbcTemplate.update(
            "UPDATE command_cache SET last_used_at = ? WHERE query_hash = ?",
            now.toEpochMilli(),
            queryHash
        );
    }

    public int updateFeedback(
        JdbcTemplate jdbcTemplate,
        String queryHash,
        int confirmationCount,
        int rejectionCount,
        double confidenceScore,
        Instant lastUsedAt
    ) {
        return jdbcTemplate.update(
            "UPDATE command_cache SET confirmation_count = ?, rejection_count = ?, confidence_score = ?, "
                + "last_used_at = COALESCE(?, last_used_at) WHERE query_hash = ?",
            confirmationCount,
            rejectionCount,
            confidenceScore,
            lastUsedAt == null ? null : lastUsedAt.toEpochMilli(),
            queryHash
        );
    }

    public int updateScore(JdbcTemplate jdbcTemplate, String queryHash, double confidenceScore) {
        return jdbcTemplate.update(
            "UPDATE command_cache SET confidence_score = ? WHERE query_hash = ?",
            confidenceScore,
            queryHash
        );
    }

    public List<CacheEntry> listMostRecent(JdbcTemplate jdbcTemplate, int limit) {
        return jdbcTemplate.query(SELECT_FIELDS + "ORDER BY last_used_at DESC, id DESC LIMIT ?", ROW_MAPPER, limit);
    }

    public List<String> listHashes(JdbcTemplate jdbcTemplate) {
        return jdbcTemplate.queryForList("SELECT query_hash FROM command_cache ORDER BY id ASC", String.class);
    }

    public List<String> listLowConfidenceHashes(JdbcTemplate jdbcTemplate, double threshold, int limit) {
        return jdbcTemplate.queryForList(
            "SELECT query_hash FROM command_cache WHERE confidence_score < ? "
                + "ORDER BY confidence_score ASC, last_used_at ASC LIMIT ?",
            String.class,
            threshold,
            limit
        );
    }

    public long count(JdbcTemplate jdbcTemplate) {
        Long value = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM command_cache", Long.class);
        return value == null ? 0L : value;
    }

    public long countInScoreRange(JdbcTemplate jdbcTemplate, double minInclusive, double maxExclusive) {
        Long value = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM command_cache WHERE confidence_score >= ? AND confidence_score < ?",
            Long.class,
            minInclusive,
            maxExclusive
        );
        return value == null ? 0L : value;
    }

    public Map<String, Object> feedbackTotals(JdbcTemplate jdbcTemplate) {
        return jdbcTemplate.queryForMap(
            "SELECT COALESCE(SUM(confirmation_count), 0) AS confirmations, "
                + "COALESCE(SUM(rejection_count), 0) AS rejections, "
                + "COALESCE(AVG(confidence_score), 0.0) AS avg_confidence "
                + "FROM command_cache"
        );
    }

    public int deleteLastUsedBefore(JdbcTemplate jdbcTemplate, Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM command_cache WHERE last_used_at < ?", cutoff.toEpochMilli());
    }

    public int deleteLeastRecentlyUsed(JdbcTemplate jdbcTemplate, long count) {
        if (count <= 0) {
            return 0;
        }
        return jdbcTemplate.update(
            "DELETE FROM command_cache WHERE id IN ("
                + "SELECT id FROM command_cache ORDER BY last_used_at ASC, id ASC LIMIT ?)",
            count
        );
    }

    public int deleteByHash(JdbcTemplate jdbcTemplate, String queryHash) {
        return jdbcTemplate.update("DELETE FROM command_cache WHERE query_hash = ?", queryHash);
    }

    public int deleteAll(JdbcTemplate jdbcTemplate) {
        return jdbcTemplate.update("DELETE FROM command_cache");
    }

    private static class CacheEntryRowMapper implements RowMapper<CacheEntry> {
        @Override
        public CacheEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new CacheEntry(
                rs.getLong("id"),
                rs.getString("query_text"),
                rs.getString("query_hash"),
                rs.getString("command"),
                rs.getInt("confirmation_count"),
                rs.getInt("rejection_count"),
                rs.getDouble("confidence_score"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("last_used_at")),
                rs.getString("os_type"),
                rs.getString("shell_type")
            );
        }
    }
}
