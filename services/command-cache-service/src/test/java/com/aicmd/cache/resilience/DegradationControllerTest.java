package com.aicmd.cache.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aicmd.cache.cache.CacheUnavailableException;
import com.aicmd.cache.store.SchemaException;
import com.aicmd.cache.store.StoreUnavailableException;
import com.aicmd.cache.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class DegradationControllerTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final DegradationController controller =
        new DegradationController(new DegradationProperties(), meterRegistry, new MutableClock(NOW));

    private static Supplier<String> failing() {
        return () -> {
            throw new CacheUnavailableException("boom", new StoreUnavailableException("disk gone"));
        };
    }

    private static void runConcurrently(int threads, int callsPerThread, Runnable call) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        call.run();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static DegradationController withThreshold(int threshold, SimpleMeterRegistry registry) {
        DegradationProperties properties = new DegradationProperties();
        properties.setErrorThreshold(threshold);
        return new DegradationController(properties, registry, new MutableClock(NOW));
    }

    @Test
    void concurrentFailuresAreAllCounted() throws Exception {
        DegradationController shared = withThreshold(1000, meterRegistry);

        runConcurrently(8, 50, () -> shared.guard("find", failing(), () -> "fallback"));

        CacheHealth health = shared.health();
        assertThat(health.enabled()).isTrue();
        assertThat(health.errorCount()).isEqualTo(400);
        assertThat(health.errorsByKind()).containsEntry(CacheErrorKind.STORE_UNAVAILABLE, 400L);

        runConcurrently(8, 50, () -> shared.guard("find", () -> "cached", () -> "fallback"));

        assertThat(shared.health().errorCount()).isZero();
    }

    @Test
    void concurrentFailuresTripOnceAndShortCircuitTheRest() throws Exception {
        DegradationController shared = withThreshold(10, meterRegistry);

        runConcurrently(8, 50, () -> shared.guard("find", failing(), () -> "fallback"));

        CacheHealth health = shared.health();
        double shortCircuits = meterRegistry.counter("aicmd_cache_short_circuit_total").count();
        assertThat(health.enabled()).isFalse();
        assertThat(health.errorCount()).isBetween(10, 17);
        assertThat(health.errorCount() + shortCircuits).isEqualTo(400.0);
    }

    @Test
    void failuresUseFallbackAndTripAtThreshold() {
        assertThat(controller.guard("find", failing(), () -> "fallback")).isEqualTo("fallback");
        assertThat(controller.guard("find", failing(), () -> "fallback")).isEqualTo("fallback");
        assertThat(controller.isEnabled()).isTrue();

        controller.guard("find", failing(), () -> "fallback");

        CacheHealth health = controller.health();
        assertThat(health.enabled()).isFalse();
        assertThat(health.errorCount()).isEqualTo(3);
        assertThat(health.errorThreshold()).isEqualTo(3);
        assertThat(health.lastError()).contains("find").contains("boom");
        assertThat(health.lastErrorAt()).isEqualTo(NOW);
        assertThat(health.errorsByKind()).containsEntry(CacheErrorKind.STORE_UNAVAILABLE, 3L);
        assertThat(meterRegistry.counter("aicmd_cache_error_total", "kind", "store_unavailable").count()).isEqualTo(3.0);
    }

    @Test
    void successLowersErrorCount() {
        controller.guard("find", failing(), () -> "fallback");
        controller.guard("find", failing(), () -> "fallback");

        assertThat(controller.guard("find", () -> "cached", () -> "fallback")).isEqualTo("cached");
        assertThat(controller.health().errorCount()).isEqualTo(1);

        controller.guard("find", failing(), () -> "fallback");
        assertThat(controller.isEnabled()).isTrue();
        assertThat(controller.health().errorCount()).isEqualTo(2);
    }

    @Test
    void successNeverDropsBelowZero() {
        controller.guard("find", () -> "cached", () -> "fallback");

        assertThat(controller.health().errorCount()).isZero();
    }

    @Test
    void disabledCacheShortCircuits() {
        for (int i = 0; i < 3; i++) {
            controller.guard("find", failing(), () -> "fallback");
        }
        AtomicInteger calls = new AtomicInteger();

        String result = controller.guard("find", () -> {
            calls.incrementAndGet();
            return "cached";
        }, () -> "fallback");

        assertThat(result).isEqualTo("fallback");
        assertThat(calls).hasValue(0);
        assertThat(controller.attempt("save", calls::incrementAndGet)).isFalse();
        assertThat(calls).hasValue(0);
        assertThat(meterRegistry.counter("aicmd_cache_short_circuit_total").count()).isEqualTo(2.0);
    }

    @Test
    void successfulCallsDoNotReEnable() {
        for (int i = 0; i < 3; i++) {
            controller.guard("find", failing(), () -> "fallback");
        }
        controller.guard("find", () -> "cached", () -> "fallback");

        assertThat(controller.isEnabled()).isFalse();
    }

    @Test
    void executeRethrowsAndRefusesWhenDisabled() {
        assertThatThrownBy(() -> controller.execute("stats", failing()))
            .isInstanceOf(CacheUnavailableException.class);
        assertThat(controller.health().errorCount()).isEqualTo(1);
        assertThat(controller.execute("stats", () -> 42)).isEqualTo(42);

        for (int i = 0; i < 3; i++) {
            controller.guard("find", failing(), () -> "fallback");
        }
        assertThatThrownBy(() -> controller.execute("stats", () -> 42))
            .isInstanceOf(CacheDisabledException.class)
            .hasMessageContaining("stats");
    }

    @Test
    void resetRestoresCleanState() {
        for (int i = 0; i < 3; i++) {
            controller.guard("find", failing(), () -> "fallback");
        }

        controller.reset();

        CacheHealth health = controller.health();
        assertThat(health.enabled()).isTrue();
        assertThat(health.errorCount()).isZero();
        assertThat(health.lastError()).isNull();
        assertThat(health.errorsByKind()).isEmpty();
        assertThat(controller.guard("find", () -> "cached", () -> "fallback")).isEqualTo("cached");
    }

    @Test
    void attemptReportsSuccess() {
        AtomicInteger calls = new AtomicInteger();

        assertThat(controller.attempt("save", calls::incrementAndGet)).isTrue();
        assertThat(controller.attempt("save", () -> {
            throw new IllegalStateException("nope");
        })).isFalse();
        assertThat(calls).hasValue(1);
        assertThat(controller.health().errorsByKind()).containsEntry(CacheErrorKind.UNKNOWN, 1L);
    }

    @Test
    void classifyFindsMostSpecificCause() {
        assertThat(CacheErrorKind.classify(new CacheUnavailableException("x", new SchemaException("bad"))))
            .isEqualTo(CacheErrorKind.SCHEMA);
        assertThat(CacheErrorKind.classify(new StoreUnavailableException("locked")))
            .isEqualTo(CacheErrorKind.STORE_UNAVAILABLE);
        assertThat(CacheErrorKind.classify(new CacheUnavailableException("x")))
            .isEqualTo(CacheErrorKind.CACHE_UNAVAILABLE);
        assertThat(CacheErrorKind.classify(new IllegalStateException("x")))
            .isEqualTo(CacheErrorKind.UNKNOWN);
    }

    @Test
    void invalidThresholdIsRejected() {
        DegradationProperties properties = new DegradationProperties();
        properties.setErrorThreshold(0);

        assertThatThrownBy(() -> new DegradationController(properties, meterRegistry, new MutableClock(NOW)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("error-threshold");
    }
}
