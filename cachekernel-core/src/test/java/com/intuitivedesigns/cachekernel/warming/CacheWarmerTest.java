/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.warming;

import com.intuitivedesigns.cachekernel.cache.MemoryCacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.JsonCodec;
import com.intuitivedesigns.cachekernel.core.NoopCacheBackend;
import com.intuitivedesigns.cachekernel.core.RecoveringCacheBackend;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheWarmerTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private CacheBackend backend;

    @BeforeEach
    void setUp() {
        backend = new MemoryCacheBackend("", 100, Duration.ofMinutes(1), Clock.systemUTC(), MetricsRuntime.noop());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private CacheWarmer warmer(int concurrency, Duration timeout) {
        return new CacheWarmer(backend, new JsonCodec(), true, concurrency, timeout, TTL);
    }

    @Test
    void testFailingTaskDoesNotStopOthers() throws Exception {
        CacheWarmer w = warmer(2, Duration.ofSeconds(5));
        w.registerTask(new WarmingTask("flags", "feature_flags:all", () -> Map.of("beta", true), null));
        w.registerTask(new WarmingTask("broken", "broken", () -> { throw new IllegalStateException("db down"); }, null));
        w.registerTask(new WarmingTask("orgs", "orgs", () -> List.of("acme"), Duration.ofMinutes(1)));

        WarmingReport report = w.warm();

        assertEquals(3, report.results().size());
        assertEquals(2, report.successCount());
        assertEquals(1, report.failureCount());

        WarmingResult broken = report.results().get(1);
        assertEquals("broken", broken.name());
        assertFalse(broken.success());
        assertTrue(broken.error() instanceof IllegalStateException);

        assertEquals("{\"beta\":true}", new String(backend.get("feature_flags:all").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals("[\"acme\"]", new String(backend.get("orgs").orElseThrow(), StandardCharsets.UTF_8));
        assertFalse(backend.exists("broken"));
    }

    @Test
    void testConcurrencyIsBounded() {
        final int limit = 2;
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        CacheWarmer w = warmer(limit, Duration.ofSeconds(10));
        for (int i = 0; i < 8; i++) {
            final int n = i;
            w.registerTask(new WarmingTask("t" + n, "k" + n, () -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                running.decrementAndGet();
                return n;
            }, null));
        }

        WarmingReport report = w.warm();

        assertEquals(8, report.successCount());
        assertTrue(peak.get() <= limit, "peak=" + peak.get());
    }

    @Test
    void testDeadlineAbandonsSlowTasks() {
        CountDownLatch never = new CountDownLatch(1);
        CacheWarmer w = warmer(2, Duration.ofMillis(300));
        w.registerTask(new WarmingTask("fast", "fast", () -> "ok", null));
        w.registerTask(new WarmingTask("slow", "slow", () -> {
            never.await();
            return "late";
        }, null));

        long start = System.nanoTime();
        WarmingReport report = w.warm();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsedMs < 3_000, "warm() took " + elapsedMs + "ms");
        assertTrue(report.results().get(0).success());
        WarmingResult slow = report.results().get(1);
        assertFalse(slow.success());
        assertTrue(slow.error() instanceof TimeoutException, String.valueOf(slow.error()));
    }

    @Test
    void testDisabledWarmerSkips() {
        AtomicInteger calls = new AtomicInteger();
        CacheWarmer w = new CacheWarmer(backend, new JsonCodec(), false, 2, Duration.ofSeconds(1), TTL);
        w.registerTask(new WarmingTask("t", "k", calls::incrementAndGet, null));

        WarmingReport report = w.warm();

        assertTrue(report.results().isEmpty());
        assertEquals(0, calls.get());
    }

    @Test
    void testUnavailableBackendSkips() {
        AtomicInteger calls = new AtomicInteger();
        try (NoopCacheBackend noop = new NoopCacheBackend()) {
            CacheWarmer w = new CacheWarmer(noop, new JsonCodec(), true, 2, Duration.ofSeconds(1), TTL);
            w.registerTask(new WarmingTask("t", "k", calls::incrementAndGet, null));

            assertTrue(w.warm().results().isEmpty());
        }
        assertEquals(0, calls.get());
    }

    @Test
    void testTasksAreRerunnable() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CacheWarmer w = warmer(1, Duration.ofSeconds(5));
        w.registerTask(new WarmingTask("counter", "counter", calls::incrementAndGet, null));

        w.warm();
        w.warm();

        assertEquals(2, calls.get());
        assertEquals("2", new String(backend.get("counter").orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void testRecoveredBackendIsWarmed() throws Exception {
        RecoveringCacheBackend recovering = new RecoveringCacheBackend(backend);
        CacheWarmer w = new CacheWarmer(recovering, new JsonCodec(), true, 2, Duration.ofSeconds(5), TTL);
        w.registerTask(new WarmingTask("flags", "feature_flags:all", () -> List.of("beta"), null));

        WarmingReport report = w.warm();

        assertEquals(1, recovering.pings());
        assertEquals(1, report.successCount());
        assertTrue(backend.exists("feature_flags:all"));
    }
}
