/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.health;

import com.intuitivedesigns.cachekernel.core.BoundedPing;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheException;

import java.time.Duration;

public final class CacheHealth {

    static final String COMPONENT = "cache";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    private CacheHealth() {}

    public static ComponentStatus check(CacheBackend backend) {
        return check(backend, DEFAULT_TIMEOUT);
    }

    public static ComponentStatus check(CacheBackend backend, Duration timeout) {
        if (backend == null) {
            return new ComponentStatus(COMPONENT, ComponentStatus.UNHEALTHY, "cache not initialized", null);
        }
        // Ping even when marked unavailable: a backend that recovers flips back on a successful ping.
        final long start = System.nanoTime();
        try {
            BoundedPing.ping(backend, timeout);
        } catch (CacheException e) {
            return new ComponentStatus(COMPONENT, ComponentStatus.UNHEALTHY, "failed to ping cache: " + e.getMessage(), null);
        }
        final Duration latency = Duration.ofNanos(System.nanoTime() - start);

        if (!backend.isAvailable()) {
            return new ComponentStatus(COMPONENT, ComponentStatus.DEGRADED, "cache unavailable (" + backend.name() + " mode)", null);
        }

        return new ComponentStatus(COMPONENT, ComponentStatus.HEALTHY, "cache responding normally", latency);
    }
}
