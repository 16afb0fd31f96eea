package com.aicmd.cache.store;

import com.aicmd.cache.config.Checks;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.store")
public class StoreProperties {
    private boolean enabled = true;
    private String directory;
    private String databaseFile = "cache.db";
    private int busyTimeoutMs = 2000;
    private long operationTimeoutMs = 10000;
    private int maxAttempts = 5;
    private long backoffBaseMs = 50;
    private long backoffMaxMs = 2000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public long getOperationTimeoutMs() {
        return operationTimeoutMs;
    }

    public void setOperationTimeoutMs(long operationTimeoutMs) {
        this.operationTimeoutMs = operationTimeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public void validate() {
        Checks.requirePositive("aicmd.store.busy-timeout-ms", busyTimeoutMs);
        Checks.requirePositive("aicmd.store.operation-timeout-ms", operationTimeoutMs);
        Checks.requirePositive("aicmd.store.max-attempts", maxAttempts);
        Checks.requireNonNegative("aicmd.store.backoff-base-ms", backoffBaseMs);
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalStateException("aicmd.store.backoff-max-ms must be >= backoff-base-ms");
        }
    }
}
