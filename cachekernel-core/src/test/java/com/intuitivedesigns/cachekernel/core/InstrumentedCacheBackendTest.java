/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import com.intuitivedesigns.cachekernel.cache.MemoryCacheBackend;
import com.intuitivedesigns.cachekernel.metrics.MicrometerMetricsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentedCacheBackendTest {

    private MicrometerMetricsRuntime metrics;
    private InstrumentedCacheBackend cache;

    @BeforeEach
    void setUp() {
        metrics = new MicrometerMetricsRuntime();
        cache = new InstrumentedCacheBackend(
                new MemoryCacheBackend("", 100, Duration.ofMinutes(1), Clock.systemUTC(), metrics), metrics);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void testHitRateIsZeroWithoutOperations() {
        assertEquals(0.0, cache.hitRate());
        assertEquals(0, cache.hits());
        assertEquals(0, cache.misses());
    }

    @Test
    void testHitRateAfterTwoHitsAndOneMiss() throws Exception {
        cache.set("k", new byte[]{1}, Duration.ofMinutes(1));

        cache.get("k");
        cache.get("k");
        cache.get("absent");

        assertEquals(66.67, cache.hitRate(), 0.1);
        assertEquals(2.0, metrics.registry().get("cache.hits").counter().count());
        assertEquals(1.0, metrics.registry().get("cache.misses").counter().count());
        assertEquals(3, metrics.registry().get("cache.get.latency").timer().count());
        assertEquals(1, metrics.registry().get("cache.set.latency").timer().count());
    }

    @Test
    void testResetStats() throws Exception {
        cache.get("absent");
        cache.resetStats();

        assertEquals(0, cache.misses());
        assertEquals(0.0, cache.hitRate());
    }

    @Test
    void testErrorsPassThroughAndAreCounted() {
        InstrumentedCacheBackend failing = new InstrumentedCacheBackend(new FailingCacheBackend(), metrics);

        assertThrows(BackendUnavailableException.class, () -> failing.get("k"));
        assertThrows(BackendUnavailableException.class, () -> failing.clear("k*"));

        assertEquals(2.0, metrics.registry().get("cache.errors").counter().count());
        assertEquals(0, failing.hits() + failing.misses());
    }

    @Test
    void testDelegatesIdentity() {
        assertEquals("memory", cache.name());
        assertTrue(cache.isAvailable());
        assertTrue(cache.delegate() instanceof MemoryCacheBackend);
    }
}
