package com.aicmd.cache.resilience;

import com.aicmd.cache.cache.CacheUnavailableException;
import com.aicmd.cache.store.SchemaException;
import com.aicmd.cache.store.StoreUnavailableException;
import java.util.Locale;

public enum CacheErrorKind {
    STORE_UNAVAILABLE,
    SCHEMA,
    CACHE_UNAVAILABLE,
    UNKNOWN;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CacheErrorKind classify(Throwable error) {
        boolean cacheLayer = false;
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 16) {
            if (current instanceof SchemaException) {
                return SCHEMA;
            }
            if (current instanceof StoreUnavailableException) {
                return STORE_UNAVAILABLE;
            }
            if (current instanceof CacheUnavailableException) {
                cacheLayer = true;
            }
            current = current.getCause();
            depth++;
        }
        return cacheLayer ? CACHE_UNAVAILABLE : UNKNOWN;
    }
}
