package com.aicmd.cache.resilience;

public class CacheDisabledException extends RuntimeException {
    public CacheDisabledException(String message) {
        super(message);
    }
}
