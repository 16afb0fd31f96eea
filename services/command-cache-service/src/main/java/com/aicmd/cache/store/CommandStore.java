package com.aicmd.cache.store;

import java.nio.file.Path;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * File-backed SQLite store shared by every process invocation of the tool.
 *
 * <p>All access goes through {@link #withConnection} or {@link #inTransaction}. Both
 * lazily open and initialize the database, retry with exponential backoff while SQLite
 * reports the file as busy, and give up once the operation deadline passes. Any
 * database failure surfaces as {@link StoreUnavailableException} (or
 * {@link SchemaException} when the tables do not have the expected shape).
 */
@Component
public class CommandStore {
    private static final Logger log = LoggerFactory.getLogger(CommandStore.class);

    private final StoreProperties properties;
    private final StoreLocationResolver locationResolver;
    private final StoreRetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Object initLock = new Object();

    private volatile StoreLocation location;
    private volatile Handle handle;

    public CommandStore(StoreProperties properties, StoreLocationResolver locationResolver) {
        this(properties, locationResolver, Thread::sleep);
    }

    CommandStore(StoreProperties properties, StoreLocationResolver locationResolver, Sleeper sleeper) {
        properties.validate();
        this.properties = properties;
        this.locationResolver = locationResolver;
        this.retryPolicy = StoreRetryPolicy.from(properties);
        this.sleeper = sleeper;
    }

    public StoreLocation resolveLocation() {
        StoreLocation resolved = location;
        if (resolved != null) {
            return resolved;
        }
        synchronized (initLock) {
            if (location == null) {
                location = locationResolver.resolveLocation();
            }
            return location;
        }
    }

    public boolean isAvailable() {
        return resolveLocation().isAvailable();
    }

    public boolean isInitialized() {
        return handle != null;
    }

    public void initialize() {
        if (handle != null) {
            return;
        }
        synchronized (initLock) {
            if (handle != null) {
                return;
            }
            StoreLocation resolved = resolveLocation();
            if (!resolved.isAvailable()) {
                throw new StoreUnavailableException("cache store location unavailable");
            }
            Handle opened = open(resolved.databasePath());
            executeWithRetry("initialize", () -> {
                SchemaInitializer.createSchema(opened.jdbcTemplate());
                SchemaInitializer.verifySchema(opened.jdbcTemplate());
                return null;
            });
            handle = opened;
            log.debug("cache store ready path={} source={}", resolved.databasePath(), resolved.source());
        }
    }

    public <T> T withConnection(String operation, StoreCallback<T> callback) {
        Handle current = requireHandle();
        return executeWithRetry(operation, () -> callback.doInStore(current.jdbcTemplate()));
    }

    /**
     * Runs the callback in a single transaction; either every statement commits or none
     * does. A busy database causes the whole transaction to be retried.
     */
    public <T> T inTransaction(String operation, StoreCallback<T> callback) {
        Handle current = requireHandle();
        return executeWithRetry(
            operation,
            () -> current.transactionTemplate().execute(status -> callback.doInStore(current.jdbcTemplate()))
        );
    }

    public Path getDatabasePath() {
        return resolveLocation().databasePath();
    }

    private Handle requireHandle() {
        Handle current = handle;
        if (current != null) {
            return current;
        }
        initialize();
        return handle;
    }

    private <T> T executeWithRetry(String operation, Supplier<T> action) {
        long deadline = System.currentTimeMillis() + properties.getOperationTimeoutMs();
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (SchemaException | StoreUnavailableException ex) {
                throw ex;
            } catch (DataAccessException | TransactionException ex) {
                boolean busy = retryPolicy.isBusy(ex);
                long delay = retryPolicy.delayFor(attempt);
                if (!busy || attempt >= maxAttempts || System.currentTimeMillis() + delay > deadline) {
                    if (busy) {
                        throw new StoreUnavailableException(
                            "store busy: " + operation + " gave up after " + attempt + " attempts",
                            ex
                        );
                    }
                    throw new StoreUnavailableException("store failure: " + operation + ": " + ex.getMessage(), ex);
                }
                log.debug("store busy operation={} attempt={}/{} retry_in_ms={}", operation, attempt, maxAttempts, delay);
                pause(operation, delay);
            }
        }
    }

    private void pause(String operation, long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("interrupted while waiting for store: " + operation, ex);
        }
    }

    private Handle open(Path databasePath) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(properties.getBusyTimeoutMs());
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databasePath.toAbsolutePath());

        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        return new Handle(jdbcTemplate, transactionTemplate);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private record Handle(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {}
}
