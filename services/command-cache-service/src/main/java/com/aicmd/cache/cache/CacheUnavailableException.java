package com.aicmd.cache.cache;

public class CacheUnavailableException extends RuntimeException {
    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
