/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Used when caching is disabled.
 * Always misses on lookups, silently discards writes, and reports itself as unavailable.
 */
public final class NoopCacheBackend implements CacheBackend {

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        // discard
    }

    @Override
    public void delete(String key) {
        // nothing stored
    }

    @Override
    public boolean exists(String key) {
        return false;
    }

    @Override
    public void clear(String pattern) {
        // nothing stored
    }

    @Override
    public void ping() {
        // always answers
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String name() {
        return "noop";
    }

    @Override
    public void close() {
        // No-op
    }
}
