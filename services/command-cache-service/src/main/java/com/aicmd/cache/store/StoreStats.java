package com.aicmd.cache.store;

public record StoreStats(boolean available, String path, long cacheEntries, long feedbackEvents, long sizeBytes) {

    public static StoreStats unavailable() {
        return new StoreStats(false, null, 0L, 0L, 0L);
    }
}
