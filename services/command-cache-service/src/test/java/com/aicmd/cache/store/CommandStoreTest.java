package com.aicmd.cache.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

class CommandStoreTest {

    @TempDir
    Path tempDir;

    private final List<Long> sleeps = new ArrayList<>();

    private StoreProperties properties() {
        StoreProperties properties = new StoreProperties();
        properties.setDirectory(tempDir.toString());
        properties.setBackoffBaseMs(1);
        properties.setBackoffMaxMs(4);
        return properties;
    }

    private CommandStore newStore(StoreProperties properties) {
        return new CommandStore(properties, new StoreLocationResolver(properties), sleeps::add);
    }

    @Test
    void initializeCreatesTablesAndIndexesAndIsIdempotent() {
        CommandStore store = newStore(properties());

        store.initialize();
        store.initialize();
        CommandStore second = newStore(properties());
        second.initialize();

        List<String> names = store.withConnection(
            "names",
            jdbc -> jdbc.queryForList("SELECT name FROM sqlite_master WHERE type IN ('table', 'index')", String.class)
        );
        assertThat(store.isInitialized()).isTrue();
        assertThat(names).contains(
            "command_cache",
            "feedback_event",
            "idx_cache_query_hash",
            "idx_cache_last_used",
            "idx_cache_confidence",
            "idx_feedback_query_hash",
            "idx_feedback_timestamp"
        );
        assertThat(store.getDatabasePath()).isEqualTo(tempDir.resolve("cache.db"));
    }

    @Test
    void unexpectedTableShapeFailsWithSchemaError() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("cache.db"));
        new JdbcTemplate(dataSource).execute(
            "CREATE TABLE command_cache (id INTEGER PRIMARY KEY, query_hash TEXT, "
                + "last_used_at INTEGER, confidence_score REAL)"
        );
        CommandStore store = newStore(properties());

        assertThatThrownBy(store::initialize)
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("command_cache");
        assertThat(store.isInitialized()).isFalse();
    }

    @Test
    void unavailableLocationFailsEveryOperation() {
        StoreProperties properties = properties();
        properties.setEnabled(false);
        CommandStore store = newStore(properties);

        assertThat(store.isAvailable()).isFalse();
        assertThatThrownBy(() -> store.withConnection("count", jdbc -> 1))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void busyFailuresAreRetriedWithBackoff() {
        CommandStore store = newStore(properties());
        store.initialize();
        AtomicInteger calls = new AtomicInteger();

        Integer result = store.withConnection("flaky", jdbc -> {
            if (calls.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("database is locked");
            }
            return 42;
        });

        assertThat(result).isEqualTo(42);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(1L, 2L);
    }

    @Test
    void givesUpAfterMaxAttemptsWhileBusy() {
        CommandStore store = newStore(properties());
        store.initialize();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> store.withConnection("stuck", jdbc -> {
            calls.incrementAndGet();
            throw new CannotAcquireLockException("database is locked");
        }))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("stuck");
        assertThat(calls.get()).isEqualTo(5);
        assertThat(sleeps).containsExactly(1L, 2L, 4L, 4L);
    }

    @Test
    void nonBusyFailuresAreNotRetried() {
        CommandStore store = newStore(properties());
        store.initialize();

        assertThatThrownBy(() -> store.withConnection(
            "bad",
            jdbc -> jdbc.queryForObject("SELECT missing_column FROM command_cache", Integer.class)
        )).isInstanceOf(StoreUnavailableException.class);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void failedTransactionLeavesNoPartialWrite() {
        CommandStore store = newStore(properties());
        store.initialize();

        assertThatThrownBy(() -> store.inTransaction("partial", jdbc -> {
            jdbc.update(
                "INSERT INTO feedback_event (query_hash, command, action, created_at) VALUES ('h', 'ls', 'confirm', 1)"
            );
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        Long events = store.withConnection(
            "count",
            jdbc -> jdbc.queryForObject("SELECT COUNT(*) FROM feedback_event", Long.class)
        );
        assertThat(events).isZero();
    }

    @Test
    void concurrentWritersFromSeparateStoresAllCommit() throws Exception {
        CommandStore first = new CommandStore(properties(), new StoreLocationResolver(properties()));
        CommandStore second = new CommandStore(properties(), new StoreLocationResolver(properties()));
        first.initialize();
        second.initialize();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                CommandStore store = worker % 2 == 0 ? first : second;
                String hash = "h" + worker;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        store.inTransaction("append", jdbc -> jdbc.update(
                            "INSERT INTO feedback_event (query_hash, command, action, created_at) VALUES (?, 'ls', 'confirm', 1)",
                            hash
                        ));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Long events = first.withConnection(
            "count",
            jdbc -> jdbc.queryForObject("SELECT COUNT(*) FROM feedback_event", Long.class)
        );
        assertThat(events).isEqualTo(100L);
    }
}
