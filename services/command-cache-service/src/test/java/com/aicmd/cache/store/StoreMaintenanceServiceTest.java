package com.aicmd.cache.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aicmd.cache.support.TestStores;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

class StoreMaintenanceServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private void insertEntry(CommandStore store, String hash) {
        store.inTransaction("insert", jdbc -> jdbc.update(
            "INSERT INTO command_cache (query_text, query_hash, command, created_at, last_used_at) VALUES (?, ?, 'ls', 1, 1)",
            "query " + hash,
            hash
        ));
    }

    @Test
    void statsCountRowsAndFileSize() {
        CommandStore store = TestStores.open(tempDir);
        insertEntry(store, "a");
        insertEntry(store, "b");
        store.inTransaction("event", jdbc -> jdbc.update(
            "INSERT INTO feedback_event (query_hash, command, action, created_at) VALUES ('a', 'ls', 'confirm', 1)"
        ));

        StoreStats stats = new StoreMaintenanceService(store, CLOCK).stats();

        assertThat(stats.available()).isTrue();
        assertThat(stats.cacheEntries()).isEqualTo(2);
        assertThat(stats.feedbackEvents()).isEqualTo(1);
        assertThat(stats.sizeBytes()).isPositive();
        assertThat(stats.path()).isEqualTo(tempDir.resolve("cache.db").toString());
    }

    @Test
    void statsOfDisabledStoreReportUnavailable() {
        StoreStats stats = new StoreMaintenanceService(TestStores.disabled(), CLOCK).stats();

        assertThat(stats.available()).isFalse();
        assertThat(stats.cacheEntries()).isZero();
    }

    @Test
    void backupWritesTimestampedConsistentCopy() {
        CommandStore store = TestStores.open(tempDir);
        insertEntry(store, "a");
        insertEntry(store, "b");

        Path backup = new StoreMaintenanceService(store, CLOCK).backup();

        assertThat(backup.getFileName().toString()).isEqualTo("cache.db.backup.20240501_101530");
        assertThat(Files.exists(backup)).isTrue();
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + backup);
        Long rows = new JdbcTemplate(dataSource).queryForObject("SELECT COUNT(*) FROM command_cache", Long.class);
        assertThat(rows).isEqualTo(2L);
    }

    @Test
    void backupRefusesToOverwriteExistingFile() throws Exception {
        CommandStore store = TestStores.open(tempDir);
        Path target = Files.createFile(tempDir.resolve("existing.db"));

        assertThatThrownBy(() -> new StoreMaintenanceService(store, CLOCK).backup(target))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("already exists");
    }
}
