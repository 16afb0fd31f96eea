package com.aicmd.cache.resilience;

import java.time.Instant;
import java.util.Map;

public record CacheHealth(
    boolean enabled,
    int errorCount,
    int errorThreshold,
    String lastError,
    Instant lastErrorAt,
    Map<CacheErrorKind, Long> errorsByKind
) {
    public CacheHealth {
        errorsByKind = Map.copyOf(errorsByKind);
    }
}
