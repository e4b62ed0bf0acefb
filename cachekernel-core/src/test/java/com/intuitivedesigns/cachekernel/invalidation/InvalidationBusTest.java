/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.invalidation;

import com.intuitivedesigns.cachekernel.cache.MemoryCacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.FailingCacheBackend;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cachekernel.spi.InvalidationBroadcaster;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvalidationBusTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final byte[] V = "1".getBytes(StandardCharsets.UTF_8);
    private static final Duration TTL = Duration.ofMinutes(5);

    private CacheBackend backend;
    private InvalidationBus bus;

    @BeforeEach
    void setUp() {
        backend = new MemoryCacheBackend("", 100, Duration.ofMinutes(1), Clock.systemUTC(), MetricsRuntime.noop());
        bus = new InvalidationBus(backend, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void testKeysAreDeleted() throws Exception {
        backend.set("a", V, TTL);
        backend.set("b", V, TTL);
        backend.set("c", V, TTL);

        bus.publish(InvalidationEvent.ofKeys("user", "a", "b"));

        assertFalse(backend.exists("a"));
        assertFalse(backend.exists("b"));
        assertTrue(backend.exists("c"));
    }

    @Test
    void testPatternIsCleared() throws Exception {
        backend.set("x:1", V, TTL);
        backend.set("x:2", V, TTL);
        backend.set("y:1", V, TTL);

        bus.publish(InvalidationEvent.ofPattern("org", "x:*"));

        assertFalse(backend.exists("x:1"));
        assertFalse(backend.exists("x:2"));
        assertTrue(backend.exists("y:1"));
    }

    @Test
    void testBroadcastCarriesNotificationKeys() throws Exception {
        List<InvalidationBroadcaster.Payload> sent = new ArrayList<>();
        bus.registerBroadcaster(sent::add);
        backend.set("feature_flags:all", V, TTL);

        bus.publish(InvalidationEvent.ofKeys("feature_flags", "feature_flags:all").withBroadcast("feature_flags"));

        assertFalse(backend.exists("feature_flags:all"));
        assertEquals(1, sent.size());
        InvalidationBroadcaster.Payload p = sent.get(0);
        assertEquals(List.of("feature_flags"), p.notificationKeys());
        assertEquals("feature_flags", p.event());
        assertEquals(NOW, p.timestamp());
    }

    @Test
    void testNoBroadcastWithoutFlagOrKeys() {
        List<InvalidationBroadcaster.Payload> sent = new ArrayList<>();
        bus.registerBroadcaster(sent::add);

        bus.publish(InvalidationEvent.ofKeys("user", "user:1"));
        bus.publish(InvalidationEvent.ofKeys("flags", "f").withBroadcast());

        assertTrue(sent.isEmpty());
    }

    @Test
    void testMissingBroadcasterStillInvalidates() throws Exception {
        backend.set("a", V, TTL);

        assertDoesNotThrow(() -> bus.publish(InvalidationEvent.ofKeys("t", "a").withBroadcast("t")));
        assertFalse(backend.exists("a"));
    }

    @Test
    void testBroadcasterFailureIsContained() throws Exception {
        backend.set("a", V, TTL);
        bus.registerBroadcaster(p -> { throw new IllegalStateException("hub down"); });

        assertDoesNotThrow(() -> bus.publish(InvalidationEvent.ofKeys("t", "a").withBroadcast("t")));
        assertFalse(backend.exists("a"));
    }

    @Test
    void testBackendFailureIsContained() {
        List<InvalidationBroadcaster.Payload> sent = new ArrayList<>();
        InvalidationBus failing = new InvalidationBus(new FailingCacheBackend());
        failing.registerBroadcaster(sent::add);

        assertDoesNotThrow(() -> failing.publish(
                new InvalidationEvent("org", List.of("org:1"), "org:*", true, List.of("organizations"))));
        assertEquals(1, sent.size());
    }
}
