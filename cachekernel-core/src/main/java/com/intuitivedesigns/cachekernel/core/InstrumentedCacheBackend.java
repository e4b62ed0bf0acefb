/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Decorator that records hits, misses, errors and latency for any backend.
 * <p>
 * Results and exceptions pass through untouched. Meters:
 * {@code cache.hits}, {@code cache.misses}, {@code cache.errors},
 * {@code cache.<op>.latency} for get/set/delete/clear.
 */
public final class InstrumentedCacheBackend implements CacheBackend {

    private final CacheBackend delegate;
    private final MetricsRuntime metrics;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public InstrumentedCacheBackend(CacheBackend delegate, MetricsRuntime metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    @Override
    public Optional<byte[]> get(String key) throws CacheException {
        final long start = System.nanoTime();
        try {
            Optional<byte[]> v = delegate.get(key);
            if (v.isPresent()) {
                hits.increment();
                metrics.counter("cache.hits");
            } else {
                misses.increment();
                metrics.counter("cache.misses");
            }
            return v;
        } catch (CacheException e) {
            metrics.counter("cache.errors");
            throw e;
        } finally {
            metrics.timer("cache.get.latency", System.nanoTime() - start);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws CacheException {
        final long start = System.nanoTime();
        try {
            delegate.set(key, value, ttl);
        } catch (CacheException e) {
            metrics.counter("cache.errors");
            throw e;
        } finally {
            metrics.timer("cache.set.latency", System.nanoTime() - start);
        }
    }

    @Override
    public void delete(String key) throws CacheException {
        final long start = System.nanoTime();
        try {
            delegate.delete(key);
        } catch (CacheException e) {
            metrics.counter("cache.errors");
            throw e;
        } finally {
            metrics.timer("cache.delete.latency", System.nanoTime() - start);
        }
    }

    @Override
    public boolean exists(String key) throws CacheException {
        return delegate.exists(key);
    }

    @Override
    public void clear(String pattern) throws CacheException {
        final long start = System.nanoTime();
        try {
            delegate.clear(pattern);
        } catch (CacheException e) {
            metrics.counter("cache.errors");
            throw e;
        } finally {
            metrics.timer("cache.clear.latency", System.nanoTime() - start);
        }
    }

    @Override
    public void ping() throws CacheException {
        delegate.ping();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public void close() {
        delegate.close();
    }

    public CacheBackend delegate() {
        return delegate;
    }

    public long hits() {
        return hits.sum();
    }

    public long misses() {
        return misses.sum();
    }

    /**
     * @return hit percentage in [0, 100]; 0 when nothing has been read yet
     */
    public double hitRate() {
        final long h = hits.sum();
        final long total = h + misses.sum();
        return total == 0 ? 0.0 : (h * 100.0) / total;
    }

    public void resetStats() {
        hits.reset();
        misses.reset();
    }
}
