/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.intuitivedesigns.cachekernel.config.CacheDomain;
import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.health.ComponentStatus;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CacheKernelTest {

    public static final class Profile {
        public String name;
        public int age;

        public Profile() {}

        Profile(String name, int age) {
            this.name = name;
            this.age = age;
        }
    }

    private CacheKernel kernel;

    @BeforeEach
    void setUp() {
        CacheSettings settings = CacheSettings.builder().enabled(true).type("memory").build();
        kernel = CacheKernel.start(settings, MetricsRuntime.noop());
    }

    @AfterEach
    void tearDown() {
        kernel.close();
    }

    @Test
    void testStartSelectsMemoryBackend() {
        assertEquals("memory", kernel.backend().name());
        assertTrue(kernel.isAvailable());
        assertEquals(ComponentStatus.HEALTHY, kernel.health().status());
    }

    @Test
    void testJsonRoundTrip() throws Exception {
        assertTrue(kernel.setJson(CacheKeys.user(1), new Profile("ada", 36), Duration.ofMinutes(1)));

        Optional<Profile> p = kernel.getJson(CacheKeys.user(1), Profile.class);

        assertTrue(p.isPresent());
        assertEquals("ada", p.get().name);
        assertEquals(36, p.get().age);
    }

    @Test
    void testGenericJson() throws Exception {
        kernel.setJson("flags", Map.of("beta", List.of("a", "b")), Duration.ofMinutes(1));

        Optional<Map<String, List<String>>> flags = kernel.getJson("flags", new TypeReference<Map<String, List<String>>>() {});

        assertEquals(List.of("a", "b"), flags.orElseThrow().get("beta"));
    }

    @Test
    void testCorruptJsonIsMiss() {
        kernel.set("k", "{not json".getBytes(StandardCharsets.UTF_8), Duration.ofMinutes(1));

        assertTrue(kernel.getJson("k", Profile.class).isEmpty());
    }

    @Test
    void testUnencodableValueRaises() {
        Object selfReferencing = new Object() {
            public Object getSelf() { return this; }
        };

        assertThrows(SerializationException.class, () -> kernel.setJson("k", selfReferencing, Duration.ofMinutes(1)));
    }

    @Test
    void testSetIfNotExists() {
        byte[] v = {1};

        assertTrue(kernel.setIfNotExists("lock", v, Duration.ofMinutes(1)));
        assertFalse(kernel.setIfNotExists("lock", v, Duration.ofMinutes(1)));
        assertTrue(kernel.exists("lock"));
    }

    @Test
    void testInvalidateAndPattern() {
        kernel.set(CacheKeys.membership(1, 1), new byte[]{1}, Duration.ofMinutes(1));
        kernel.set(CacheKeys.membership(1, 2), new byte[]{1}, Duration.ofMinutes(1));
        kernel.set(CacheKeys.membership(2, 1), new byte[]{1}, Duration.ofMinutes(1));
        kernel.set(CacheKeys.user(9), new byte[]{1}, Duration.ofMinutes(1));

        kernel.invalidate(CacheKeys.user(9));
        kernel.invalidatePattern(CacheKeys.orgMemberships(1));

        assertFalse(kernel.exists(CacheKeys.user(9)));
        assertFalse(kernel.exists(CacheKeys.membership(1, 1)));
        assertFalse(kernel.exists(CacheKeys.membership(1, 2)));
        assertTrue(kernel.exists(CacheKeys.membership(2, 1)));
    }

    @Test
    void testTtlForDomain() {
        assertEquals(Duration.ofMinutes(15), kernel.ttlFor(CacheDomain.SESSION));
        assertEquals(Duration.ofMinutes(5), kernel.ttlFor("unknown"));
    }

    @Test
    void testFailOpenOnBackendOutage() throws Exception {
        CacheSettings settings = CacheSettings.builder().enabled(true).build();
        try (CacheKernel broken = new CacheKernel(settings, new FailingCacheBackend(), MetricsRuntime.noop())) {
            assertTrue(broken.get("k").isEmpty());
            assertFalse(broken.set("k", new byte[]{1}, Duration.ofMinutes(1)));
            assertFalse(broken.exists("k"));
            assertFalse(broken.setIfNotExists("k", new byte[]{1}, Duration.ofMinutes(1)));
            assertDoesNotThrow(() -> broken.invalidate("k"));
            assertDoesNotThrow(() -> broken.invalidatePattern("k*"));
            assertFalse(broken.setJson("k", new Profile("x", 1), Duration.ofMinutes(1)));

            // Loads still succeed with the cache gone
            assertEquals("fresh", broken.aside().get("k", Duration.ofMinutes(1), String.class, () -> "fresh"));
            assertEquals(ComponentStatus.UNHEALTHY, broken.health().status());
        }
    }

    @Test
    void testDisabledKernelIsNoop() throws Exception {
        try (CacheKernel off = CacheKernel.start(CacheSettings.builder().build(), MetricsRuntime.noop())) {
            assertFalse(off.isAvailable());
            assertTrue(off.set("k", new byte[]{1}, Duration.ofMinutes(1)));
            assertTrue(off.get("k").isEmpty());
            assertEquals(ComponentStatus.DEGRADED, off.health().status());
            assertEquals(0, off.warmer().warm().results().size());
        }
    }

    @Test
    void testCloseIsIdempotent() {
        kernel.close();
        assertDoesNotThrow(kernel::close);
    }
}
