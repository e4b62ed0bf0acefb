/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.warming;

import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.core.BoundedPing;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheException;
import com.intuitivedesigns.cachekernel.core.JsonCodec;
import com.intuitivedesigns.cachekernel.core.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Preloads frequently read data into the cache.
 * <p>
 * Runs every registered task with at most {@code concurrency} executing at once and one overall deadline.
 * A failing task does not affect the others. Tasks still running at the deadline are interrupted and
 * reported as failed with a {@link TimeoutException}; loaders that ignore interruption keep running
 * in the background until they return.
 */
public final class CacheWarmer {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

    private static final Duration RECHECK_TIMEOUT = Duration.ofSeconds(2);

    private final CacheBackend backend;
    private final JsonCodec codec;
    private final boolean enabled;
    private final int concurrency;
    private final Duration timeout;
    private final Duration defaultTtl;

    private final List<WarmingTask> tasks = new CopyOnWriteArrayList<>();

    public CacheWarmer(CacheBackend backend, JsonCodec codec, boolean enabled, int concurrency,
                       Duration timeout, Duration defaultTtl) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.codec = Objects.requireNonNull(codec, "codec");
        if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be > 0");
        this.enabled = enabled;
        this.concurrency = concurrency;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.defaultTtl = defaultTtl;
    }

    public static CacheWarmer fromSettings(CacheBackend backend, JsonCodec codec, CacheSettings settings) {
        return new CacheWarmer(backend, codec, settings.warmingEnabled, settings.warmingConcurrency,
                settings.warmingTimeout, settings.defaultTtl());
    }

    public void registerTask(WarmingTask task) {
        tasks.add(Objects.requireNonNull(task, "task"));
    }

    public List<WarmingTask> tasks() {
        return List.copyOf(tasks);
    }

    public WarmingReport warm() {
        if (enabled && !backend.isAvailable()) {
            recheck();
        }
        if (!enabled || !backend.isAvailable()) {
            log.info("Cache warming skipped (disabled or cache unavailable)");
            return WarmingReport.skipped();
        }

        final List<WarmingTask> batch = List.copyOf(tasks);
        log.info("Starting cache warming: tasks={} concurrency={} timeout={}", batch.size(), concurrency, timeout);

        final long startNanos = System.nanoTime();
        final long deadlineNanos = startNanos + timeout.toNanos();
        final Semaphore limiter = new Semaphore(concurrency);
        final ExecutorService executor = Executors.newCachedThreadPool(new NamedDaemonThreadFactory("cache-warming"));

        final List<WarmingResult> results = new ArrayList<>(batch.size());
        try {
            final List<Future<WarmingResult>> futures = new ArrayList<>(batch.size());
            for (WarmingTask task : batch) {
                futures.add(executor.submit(() -> {
                    limiter.acquire();
                    try {
                        return execute(task);
                    } finally {
                        limiter.release();
                    }
                }));
            }

            for (int i = 0; i < batch.size(); i++) {
                results.add(await(batch.get(i), futures.get(i), startNanos, deadlineNanos));
            }
        } finally {
            executor.shutdownNow();
        }

        final WarmingReport report = new WarmingReport(results, Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("Cache warming completed: total={} success={} failed={} duration={}ms",
                results.size(), report.successCount(), report.failureCount(), report.elapsed().toMillis());
        return report;
    }

    private void recheck() {
        try {
            BoundedPing.ping(backend, RECHECK_TIMEOUT);
        } catch (CacheException e) {
            log.debug("Cache still unreachable before warming: {}", e.getMessage());
        }
    }

    private WarmingResult await(WarmingTask task, Future<WarmingResult> future, long startNanos, long deadlineNanos) {
        final long remaining = deadlineNanos - System.nanoTime();
        try {
            return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Cache warming task abandoned at deadline: task={}", task.name());
            return WarmingResult.failed(task.name(),
                    new TimeoutException("warming deadline of " + timeout.toMillis() + "ms exceeded"), since(startNanos));
        } catch (ExecutionException e) {
            // Only reached if the semaphore wait was interrupted; execute() reports its own failures.
            return WarmingResult.failed(task.name(), e.getCause(), since(startNanos));
        } catch (CancellationException e) {
            return WarmingResult.failed(task.name(), e, since(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return WarmingResult.failed(task.name(), e, since(startNanos));
        }
    }

    private WarmingResult execute(WarmingTask task) {
        final long start = System.nanoTime();

        final Object data;
        try {
            data = task.loader().load();
        } catch (Exception e) {
            log.warn("Cache warming task failed to load data: task={} error={}", task.name(), e.toString());
            return WarmingResult.failed(task.name(), e, since(start));
        }

        try {
            final Duration ttl = (task.ttl() != null) ? task.ttl() : defaultTtl;
            backend.set(task.cacheKey(), codec.encode(task.cacheKey(), data), ttl);
        } catch (Exception e) {
            log.warn("Cache warming task failed to store data: task={} key={} error={}", task.name(), task.cacheKey(), e.getMessage());
            return WarmingResult.failed(task.name(), e, since(start));
        }

        final Duration latency = since(start);
        log.debug("Cache warming task completed: task={} key={} latency={}ms", task.name(), task.cacheKey(), latency.toMillis());
        return WarmingResult.succeeded(task.name(), latency);
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
