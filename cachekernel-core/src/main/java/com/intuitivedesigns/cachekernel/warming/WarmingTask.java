/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.warming;

import com.intuitivedesigns.cachekernel.aside.CacheLoader;

import java.time.Duration;
import java.util.Objects;

/**
 * A named preload: run {@code loader} and store its result as JSON under {@code cacheKey}.
 * Stateless and re-runnable.
 *
 * @param ttl entry TTL; {@code null} uses the warmer's default TTL
 */
public record WarmingTask(String name, String cacheKey, CacheLoader<?> loader, Duration ttl) {
    public WarmingTask {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cacheKey, "cacheKey");
        Objects.requireNonNull(loader, "loader");
    }
}
