/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void testMetersReachBackingRegistry() {
        SimpleMeterRegistry backing = new SimpleMeterRegistry();
        MicrometerMetricsRuntime rt = new MicrometerMetricsRuntime(backing, "TEST", null);

        rt.counter("cache.hits");
        rt.counter("cache.hits", 2.0);
        rt.counter("cache.hits", -1.0);
        rt.timer("cache.get.latency", TimeUnit.MILLISECONDS.toNanos(3));
        rt.gauge("cache.memory.size", 5);
        rt.gauge("cache.memory.size", 7);

        assertEquals(3.0, backing.get("cache.hits").counter().count());
        assertEquals(1L, backing.get("cache.get.latency").timer().count());
        assertEquals(7.0, backing.get("cache.memory.size").gauge().value());
        assertTrue(rt.enabled());
        assertEquals("TEST", rt.type());
    }

    @Test
    void testCloseRunsHook() {
        AtomicBoolean closed = new AtomicBoolean();
        new MicrometerMetricsRuntime(new SimpleMeterRegistry(), null, () -> closed.set(true)).close();

        assertTrue(closed.get());
    }

    @Test
    void testNoopIgnoresEverything() {
        MetricsRuntime noop = MetricsRuntime.noop();

        assertFalse(noop.enabled());
        assertEquals("NOOP", noop.type());
        assertDoesNotThrow(() -> {
            noop.counter("x");
            noop.timer("y", 1L);
            noop.gauge("z", 1.0);
            noop.close();
        });
    }
}
