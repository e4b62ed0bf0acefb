/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.cache;

import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.KeySpace;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process cache backend.
 *
 * Characteristics:
 * - Thread-safe (single map behind a read/write lock: many readers, one writer)
 * - TTL checked on every read, plus a periodic sweep on a background thread
 * - Bounded (maxSize); when full, expired entries go first, then one arbitrary entry
 *
 * Trade-off:
 * Eviction is NOT recency based. Hot keys can be evicted under pressure; size the cache accordingly.
 */
public final class MemoryCacheBackend implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheBackend.class);

    private final Map<String, Entry> data = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final KeySpace keys;
    private final int maxSize;
    private final Clock clock;
    private final MetricsRuntime metrics;
    private final ScheduledExecutorService sweeper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MemoryCacheBackend(CacheSettings settings, MetricsRuntime metrics) {
        this(settings.keyPrefix, settings.memoryMaxSize, settings.memoryCleanupInterval, Clock.systemUTC(), metrics);
    }

    /**
     * @param maxSize maximum entry count; {@code <= 0} means unbounded
     */
    public MemoryCacheBackend(String keyPrefix, int maxSize, Duration cleanupInterval, Clock clock, MetricsRuntime metrics) {
        Objects.requireNonNull(cleanupInterval, "cleanupInterval");
        this.keys = new KeySpace(keyPrefix);
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();

        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-memory-sweeper");
            t.setDaemon(true);
            return t;
        });
        final long periodMs = Math.max(1L, cleanupInterval.toMillis());
        this.sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);

        log.info("In-memory cache ready (prefix='{}', maxSize={}, cleanupInterval={})",
                keys.prefix(), maxSize > 0 ? maxSize : "unbounded", cleanupInterval);
    }

    @Override
    public Optional<byte[]> get(String key) {
        lock.readLock().lock();
        try {
            Entry e = data.get(keys.apply(key));
            if (e == null || e.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(Arrays.copyOf(e.value, e.value.length));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        final byte[] copy = Arrays.copyOf(value, value.length);
        final Instant now = clock.instant();
        final Instant expiresAt = (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : now.plus(ttl);
        final String stored = keys.apply(key);

        lock.writeLock().lock();
        try {
            if (maxSize > 0 && data.size() >= maxSize && !data.containsKey(stored)) {
                evict(now);
            }
            data.put(stored, new Entry(copy, expiresAt));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.writeLock().lock();
        try {
            data.remove(keys.apply(key));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        lock.readLock().lock();
        try {
            Entry e = data.get(keys.apply(key));
            return e != null && !e.isExpired(clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear(String pattern) {
        final String stored = keys.apply(pattern);

        lock.writeLock().lock();
        try {
            if (KeySpace.isPrefixPattern(stored)) {
                data.keySet().removeIf(k -> KeySpace.matches(stored, k));
            } else {
                data.remove(stored);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void ping() {
        // Always reachable.
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * Observability helper. Counts entries that are expired but not yet swept.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every expired entry now.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        final Instant now = clock.instant();
        int removed = 0;
        int remaining;

        lock.writeLock().lock();
        try {
            Iterator<Entry> it = data.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            remaining = data.size();
        } finally {
            lock.writeLock().unlock();
        }

        if (removed > 0) {
            metrics.counter("cache.memory.expired", removed);
            log.debug("Swept {} expired entries ({} remaining)", removed, remaining);
        }
        metrics.gauge("cache.memory.size", remaining);
        return removed;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        sweeper.shutdownNow();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Cache sweeper did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("In-memory cache closed.");
    }

    // Caller holds the write lock.
    private void evict(Instant now) {
        int expired = 0;
        Iterator<Entry> it = data.values().iterator();
        while (it.hasNext() && data.size() >= maxSize) {
            if (it.next().isExpired(now)) {
                it.remove();
                expired++;
            }
        }
        if (expired > 0) {
            metrics.counter("cache.memory.expired", expired);
        }

        if (data.size() >= maxSize) {
            // Arbitrary victim: whatever the map yields first.
            Iterator<String> victim = data.keySet().iterator();
            if (victim.hasNext()) {
                String k = victim.next();
                victim.remove();
                metrics.counter("cache.memory.evictions");
                log.debug("Capacity {} reached, evicted '{}'", maxSize, k);
            }
        }
    }

    private void sweepQuietly() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            // A throwing task would cancel the schedule; keep sweeping.
            log.warn("Cache sweep failed", e);
        }
    }

    private static final class Entry {
        final byte[] value;
        final Instant expiresAt;

        Entry(byte[] value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return expiresAt != null && now.isAfter(expiresAt);
        }
    }
}
