package com.aicmd.cache.repository;

import java.time.Instant;

public class CacheEntry {
    private final long id;
    private final String queryText;
    private final String queryHash;
    private final String command;
    private final int confirmationCount;
    private final int rejectionCount;
    private final double confidenceScore;
    private final Instant createdAt;
    private final Instant lastUsedAt;
    private final String osType;
    private final String shellType;

    public CacheEntry(
        long id,
        String queryText,
        String queryHash,
        String command,
        int confirmationCount,
        int rejectionCount,
        double confidenceScore,
        Instant createdAt,
        Instant lastUsedAt,
        String osType,
        String shellType
    ) {
        this.id = id;
        this.queryText = queryText;
        this.queryHash = queryHash;
        this.command = command;
        this.confirmationCount = confirmationCount;
        this.rejectionCount = rejectionCount;
        this.confidenceScore = confidenceScore;
        this.createdAt = createdAt;
        this.lastUsedAt = lastUsedAt;
        this.osType = osType;
        this.shellType = shellType;
    }

    public long getId() {
        return id;
    }

    public String getQueryText() {
        return queryText;
    }

    public String getQueryHash() {
        return queryHash;
    }

    public String getCommand() {
        return command;
    }

    public int getConfirmationCount() {
        return confirmationCount;
    }

    public int getRejectionCount() {
        return rejectionCount;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public String getOsType() {
        return osType;
    }

    public String getShellType() {
        return shellType;
    }

    @Override
    public String toString() {
        return "CacheEntry{hash=" + queryHash
            + ", command='" + command + '\''
            + ", confirmations=" + confirmationCount
            + ", rejections=" + rejectionCount
            + ", confidence=" + confidenceScore + '}';
    }
}
