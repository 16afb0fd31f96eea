package com.aicmd.cache.store;

import java.sql.SQLException;
import org.springframework.dao.PessimisticLockingFailureException;

public class StoreRetryPolicy {
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public StoreRetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
    }

    public static StoreRetryPolicy from(StoreProperties properties) {
        return new StoreRetryPolicy(
            properties.getMaxAttempts(),
            properties.getBackoffBaseMs(),
            properties.getBackoffMaxMs()
        );
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long delayFor(int attempt) {
        if (attempt < 1 || baseDelayMs == 0) {
            return 0L;
        }
        int shift = Math.min(attempt - 1, 20);
        long delay = baseDelayMs << shift;
        return Math.min(maxDelayMs, delay);
    }

    public boolean isBusy(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 16) {
            if (current instanceof PessimisticLockingFailureException) {
                return true;
            }
            if (current instanceof SQLException sqlException) {
                int primaryCode = sqlException.getErrorCode() & 0xFF;
                if (primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED) {
                    return true;
                }
                String message = sqlException.getMessage();
                if (message != null && (message.contains("SQLITE_BUSY") || message.contains("database is locked"))) {
                    return true;
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
