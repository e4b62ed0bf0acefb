/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.aside;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheException;
import com.intuitivedesigns.cachekernel.core.JsonCodec;
import com.intuitivedesigns.cachekernel.core.NamedDaemonThreadFactory;
import com.intuitivedesigns.cachekernel.core.SerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;

/**
 * Load-through cache with stampede protection.
 * <p>
 * On a miss, concurrent callers for the same key are coalesced so the loader runs at most once at a time per key.
 * The cache is re-checked inside the coalesced section before loading.
 * <ul>
 *   <li>{@code get*}: the loaded value is written on a background thread, bounded by the write timeout.
 *       Best effort; a reader right after may still miss.</li>
 *   <li>{@code getSync*}: the value is written before returning.</li>
 * </ul>
 * Cache failures never surface to the caller: a failed read counts as a miss and a failed write is logged.
 * Loader exceptions are rethrown to every coalesced caller and nothing is cached.
 */
public final class CacheAside implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheAside.class);

    private static final int WRITER_THREADS = 4;
    private static final int WRITER_QUEUE = 10_000;

    private final CacheBackend backend;
    private final JsonCodec codec;
    private final Duration writeTimeout;
    private final SingleFlight flight = new SingleFlight();
    private final ExecutorService writer;

    private final LongAdder droppedWrites = new LongAdder();

    public CacheAside(CacheBackend backend, JsonCodec codec, Duration writeTimeout) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");

        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                WRITER_THREADS, WRITER_THREADS, 30, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(WRITER_QUEUE),
                new NamedDaemonThreadFactory("cache-aside-writer"),
                (r, executor) -> {
                    throw new RejectedExecutionException("cache write queue full");
                });
        pool.allowCoreThreadTimeOut(true);
        this.writer = pool;
    }

    public <T> T get(String key, Duration ttl, Class<T> type, CacheLoader<T> loader) throws Exception {
        return load(key, ttl, codec.type(type), loader, false);
    }

    public <T> T get(String key, Duration ttl, TypeReference<T> type, CacheLoader<T> loader) throws Exception {
        return load(key, ttl, codec.type(type), loader, false);
    }

    public <T> T getSync(String key, Duration ttl, Class<T> type, CacheLoader<T> loader) throws Exception {
        return load(key, ttl, codec.type(type), loader, true);
    }

    public <T> T getSync(String key, Duration ttl, TypeReference<T> type, CacheLoader<T> loader) throws Exception {
        return load(key, ttl, codec.type(type), loader, true);
    }

    /**
     * @return asynchronous writes dropped because the write queue was full
     */
    public long droppedWrites() {
        return droppedWrites.sum();
    }

    private <T> T load(String key, Duration ttl, JavaType type, CacheLoader<T> loader, boolean sync) throws Exception {
        Objects.requireNonNull(loader, "loader");

        final Optional<T> cached = read(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }

        final SingleFlight.Result<T> result = flight.execute(key, () -> {
            // Another caller may have filled the key while this one waited.
            final Optional<T> again = read(key, type);
            if (again.isPresent()) {
                return again.get();
            }

            final T loaded = loader.load();
            if (loaded != null) {
                if (sync) {
                    write(key, loaded, ttl);
                } else {
                    writeAsync(key, loaded, ttl);
                }
            }
            return loaded;
        });

        if (result.shared()) {
            log.debug("Cache request coalesced key={}", key);
        }
        return result.value();
    }

    private <T> Optional<T> read(String key, JavaType type) {
        try {
            final Optional<byte[]> raw = backend.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(codec.decode(key, raw.get(), type));
        } catch (SerializationException e) {
            log.debug("Ignoring undecodable cache value key={}: {}", key, e.getMessage());
            return Optional.empty();
        } catch (CacheException e) {
            log.debug("Cache read failed, loading from source key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        try {
            backend.set(key, codec.encode(key, value), ttl);
        } catch (CacheException e) {
            log.warn("Failed to cache result key={}: {}", key, e.getMessage());
        }
    }

    private void writeAsync(String key, Object value, Duration ttl) {
        // Encode now so later mutation of the returned value cannot leak into the cache.
        final byte[] bytes;
        try {
            bytes = codec.encode(key, value);
        } catch (SerializationException e) {
            log.warn("Failed to cache result key={}: {}", key, e.getMessage());
            return;
        }

        final CompletableFuture<Void> f;
        try {
            f = CompletableFuture.runAsync(() -> {
                try {
                    backend.set(key, bytes, ttl);
                } catch (CacheException e) {
                    throw new CompletionException(e);
                }
            }, writer);
        } catch (RejectedExecutionException e) {
            droppedWrites.increment();
            log.debug("Dropped cache write key={}: {}", key, e.getMessage());
            return;
        }

        f.orTimeout(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, err) -> {
                    if (err == null) return;
                    final Throwable cause = (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
                    if (cause instanceof TimeoutException) {
                        log.warn("Cache write timed out after {}ms key={}", writeTimeout.toMillis(), key);
                    } else {
                        log.warn("Failed to cache result key={}: {}", key, cause.getMessage());
                    }
                });
    }

    /**
     * Stops accepting writes and waits briefly for queued ones.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
