package com.aicmd.cache.store;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;

public final class SchemaInitializer {
    static final String CACHE_TABLE = "command_cache";
    static final String FEEDBACK_TABLE = "feedback_event";

    private static final List<String> DDL = List.of(
        "CREATE TABLE IF NOT EXISTS command_cache ("
            + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
            + "query_text TEXT NOT NULL, "
            + "query_hash TEXT NOT NULL UNIQUE, "
            + "command TEXT NOT NULL, "
            + "confirmation_count INTEGER NOT NULL DEFAULT 0, "
            + "rejection_count INTEGER NOT NULL DEFAULT 0, "
            + "confidence_score REAL NOT NULL DEFAULT 0.0, "
            + "created_at INTEGER NOT NULL, "
            + "last_used_at INTEGER NOT NULL, "
            + "os_type TEXT, "
            + "shell_type TEXT)",
        "CREATE TABLE IF NOT EXISTS feedback_event ("
            + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
            + "query_hash TEXT NOT NULL, "
            + "command TEXT NOT NULL, "
            + "action TEXT NOT NULL, "
            + "created_at INTEGER NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_cache_query_hash ON command_cache (query_hash)",
        "CREATE INDEX IF NOT EXISTS idx_cache_last_used ON command_cache (last_used_at)",
        "CREATE INDEX IF NOT EXISTS idx_cache_confidence ON command_cache (confidence_score)",
        "CREATE INDEX IF NOT EXISTS idx_feedback_query_hash ON feedback_event (query_hash)",
        "CREATE INDEX IF NOT EXISTS idx_feedback_timestamp ON feedback_event (created_at)"
    );

    static final Set<String> REQUIRED_CACHE_COLUMNS = Set.of(
        "id",
        "query_text",
        "query_hash",
        "command",
        "confirmation_count",
        "rejection_count",
        "confidence_score",
        "created_at",
        "last_used_at",
        "os_type",
        "shell_type"
    );

    static final Set<String> REQUIRED_FEEDBACK_COLUMNS = Set.of("id", "query_hash", "command", "action", "created_at");

    static final Set<String> REQUIRED_INDEXES = Set.of(
        "idx_cache_query_hash",
        "idx_cache_last_used",
        "idx_cache_confidence",
        "idx_feedback_query_hash",
        "idx_feedback_timestamp"
    );

    private SchemaInitializer() {
    }

    public static void createSchema(JdbcTemplate jdbcTemplate) {
        for (String statement : DDL) {
            jdbcTemplate.execute(statement);
        }
    }

    public static void verifySchema(JdbcTemplate jdbcTemplate) {
        requireColumns(jdbcTemplate, CACHE_TABLE, REQUIRED_CACHE_COLUMNS);
        requireColumns(jdbcTemplate, FEEDBACK_TABLE, REQUIRED_FEEDBACK_COLUMNS);

        List<String> indexes = jdbcTemplate.queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'index'",
            String.class
        );
        Set<String> missing = new HashSet<>(REQUIRED_INDEXES);
        missing.removeAll(indexes);
        if (!missing.isEmpty()) {
            throw new SchemaException("missing indexes: " + missing);
        }
    }

    private static void requireColumns(JdbcTemplate jdbcTemplate, String table, Set<String> required) {
        Integer tables = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?",
            Integer.class,
            table
        );
        if (tables == null || tables == 0) {
            throw new SchemaException("missing table: " + table);
        }
        Set<String> columns = new HashSet<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList("PRAGMA table_info(" + table + ")")) {
            Object name = row.get("name");
            if (name != null) {
                columns.add(name.toString());
            }
        }
        Set<String> missing = new HashSet<>(required);
        missing.removeAll(columns);
        if (!missing.isEmpty()) {
            throw new SchemaException("table " + table + " missing columns: " + missing);
        }
    }
}
