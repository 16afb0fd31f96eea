package com.aicmd.cache.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Circuit breaker around every cache call.
 *
 * <p>Each failure raises the error count and each success lowers it by one. Once the count
 * reaches the threshold the cache is disabled and stays disabled until {@link #reset()}.
 * While disabled, guarded calls go straight to their fallback.
 */
@Component
public class DegradationController {
    private static final Logger log = LoggerFactory.getLogger(DegradationController.class);

    private final int errorThreshold;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<CacheErrorKind, Long> errorsByKind = new EnumMap<>(CacheErrorKind.class);

    private boolean enabled = true;
    private int errorCount;
    private String lastError;
    private Instant lastErrorAt;

    public DegradationController(DegradationProperties properties, MeterRegistry meterRegistry, Clock clock) {
        properties.validate();
        this.errorThreshold = properties.getErrorThreshold();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Runs {@code cacheOp} while the cache is enabled and returns its result. If the cache is
     * disabled or the call throws, the failure is recorded and {@code fallback} runs instead.
     * Exceptions thrown by the fallback itself propagate to the caller.
     */
    public <T> T guard(String operation, Supplier<T> cacheOp, Supplier<T> fallback) {
        if (!isEnabled()) {
            meterRegistry.counter("aicmd_cache_short_circuit_total").increment();
            log.debug("cache disabled, using fallback operation={}", operation);
            return fallback.get();
        }
        T result;
        try {
            result = cacheOp.get();
        } catch (RuntimeException ex) {
            recordFailure(operation, ex);
            return fallback.get();
        }
        recordSuccess();
        return result;
    }

    public boolean attempt(String operation, Runnable cacheOp) {
        return guard(operation, () -> {
            cacheOp.run();
            return Boolean.TRUE;
        }, () -> Boolean.FALSE);
    }

    public <T> T execute(String operation, Supplier<T> action) {
        if (!isEnabled()) {
            meterRegistry.counter("aicmd_cache_short_circuit_total").increment();
            throw new CacheDisabledException("cache disabled after repeated errors; reset required (" + operation + ")");
        }
        T result;
        try {
            result = action.get();
        } catch (RuntimeException ex) {
            recordFailure(operation, ex);
            throw ex;
        }
        recordSuccess();
        return result;
    }

    public boolean isEnabled() {
        lock.lock();
        try {
            return enabled;
        } finally {
            lock.unlock();
        }
    }

    public CacheHealth health() {
        lock.lock();
        try {
            return new CacheHealth(enabled, errorCount, errorThreshold, lastError, lastErrorAt, errorsByKind);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            enabled = true;
            errorCount = 0;
            lastError = null;
            lastErrorAt = null;
            errorsByKind.clear();
        } finally {
            lock.unlock();
        }
        log.info("cache error state reset");
    }

    private void recordSuccess() {
        lock.lock();
        try {
            if (errorCount > 0) {
                errorCount--;
            }
        } finally {
            lock.unlock();
        }
    }

    private void recordFailure(String operation, RuntimeException error) {
        CacheErrorKind kind = CacheErrorKind.classify(error);
        meterRegistry.counter("aicmd_cache_error_total", "kind", kind.tag()).increment();
        boolean tripped = false;
        int count;
        lock.lock();
        try {
            errorCount++;
            count = errorCount;
            lastError = operation + ": " + error.getMessage();
            lastErrorAt = clock.instant();
            errorsByKind.merge(kind, 1L, Long::sum);
            if (enabled && errorCount >= errorThreshold) {
                enabled = false;
                tripped = true;
            }
        } finally {
            lock.unlock();
        }
        log.warn("cache operation failed operation={} kind={} error_count={} error={}", operation, kind.tag(), count, error.getMessage());
        if (tripped) {
            log.error("cache disabled after {} errors; run with --reset-cache-errors to re-enable", count);
        }
    }
}
