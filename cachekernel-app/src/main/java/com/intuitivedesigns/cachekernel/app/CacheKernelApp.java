/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.app;

import com.intuitivedesigns.cachekernel.config.CacheDomain;
import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.config.KernelConfig;
import com.intuitivedesigns.cachekernel.core.CacheKernel;
import com.intuitivedesigns.cachekernel.core.InstrumentedCacheBackend;
import com.intuitivedesigns.cachekernel.core.NamedDaemonThreadFactory;
import com.intuitivedesigns.cachekernel.metrics.MetricsFactory;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cachekernel.metrics.MetricsSettings;
import com.intuitivedesigns.cachekernel.warming.WarmingReport;
import com.intuitivedesigns.cachekernel.warming.WarmingTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class CacheKernelApp {

    private static final Logger log = LoggerFactory.getLogger(CacheKernelApp.class);

    // --- Config Keys ---
    private static final String CFG_STATS_ENABLED = "cache.stats.enabled";
    private static final String CFG_STATS_WINDOW_SECONDS = "cache.stats.window.seconds";

    // --- Defaults ---
    private static final int DEFAULT_WINDOW_SECONDS = 30;
    private static final int MIN_WINDOW_SECONDS = 5;
    private static final int MAX_WINDOW_SECONDS = 300;

    static final String SELF_CHECK_KEY = "kernel:self_check";

    private CacheKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting CacheKernel ===");

        final KernelConfig config = KernelConfig.load();

        MetricsRuntime metrics = null;
        CacheKernel kernel = null;
        ScheduledExecutorService statsScheduler = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Kernel + warming
            kernel = start(config, metrics);

            // 3. Periodic hit-rate log
            final boolean statsEnabled = config.getBoolean(CFG_STATS_ENABLED, true);
            final int windowSeconds = clampInt(config.getInt(CFG_STATS_WINDOW_SECONDS, DEFAULT_WINDOW_SECONDS),
                    MIN_WINDOW_SECONDS, MAX_WINDOW_SECONDS);
            if (statsEnabled) {
                statsScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("ck-stats"));
                startStatsReporter(statsScheduler, kernel.backend(), windowSeconds);
            }

            // 4. Shutdown hook
            final MetricsRuntime finalMetrics = metrics;
            final CacheKernel finalKernel = kernel;
            final ScheduledExecutorService finalStatsScheduler = statsScheduler;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }

                log.info("Shutdown signal received.");
                try {
                    if (finalStatsScheduler != null) {
                        finalStatsScheduler.shutdownNow();
                    }
                } finally {
                    closeQuietly(finalKernel);
                    closeQuietly(finalMetrics);
                    shutdownLatch.countDown();
                }
            }, "ck-shutdown"));

            log.info("CacheKernel ready: backend={} health={}", kernel.backend().name(), kernel.health().status());
            shutdownLatch.await();
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                if (statsScheduler != null) {
                    statsScheduler.shutdownNow();
                }
                closeQuietly(kernel);
                closeQuietly(metrics);
                shutdownLatch.countDown();
            }

            System.exit(1);
        }
    }

    /**
     * Starts the kernel, registers the built-in warming tasks and runs one warming pass.
     */
    static CacheKernel start(KernelConfig config, MetricsRuntime metrics) {
        final CacheSettings settings = CacheSettings.from(config);
        log.info("CONFIG: {}", settings);

        final CacheKernel kernel = CacheKernel.start(settings, metrics);

        kernel.warmer().registerTask(new WarmingTask(
                "self_check",
                SELF_CHECK_KEY,
                () -> Map.of("status", "ok", "startedAt", Instant.now().toString()),
                settings.ttlFor(CacheDomain.HEALTH_CHECK)));

        final WarmingReport report = kernel.warmer().warm();
        if (report.failureCount() > 0) {
            log.warn("Cache warming finished with {} failed task(s)", report.failureCount());
        }
        return kernel;
    }

    private static void startStatsReporter(ScheduledExecutorService scheduler, InstrumentedCacheBackend backend, int windowSeconds) {
        log.info("Cache stats reporter active ({}s window)", windowSeconds);

        scheduler.scheduleAtFixedRate(new Runnable() {
            private long lastHits = 0;
            private long lastMisses = 0;

            @Override
            public void run() {
                try {
                    final long hits = backend.hits();
                    final long misses = backend.misses();
                    final long windowHits = hits - lastHits;
                    final long windowMisses = misses - lastMisses;
                    final long reads = windowHits + windowMisses;
                    final double rate = reads == 0 ? 0.0 : (windowHits * 100.0) / reads;

                    log.info(String.format(
                            Locale.US,
                            "AVG %ds | HITS: %,d | MISSES: %,d | HIT RATE: %.2f%% | TOTAL HIT RATE: %.2f%%",
                            windowSeconds, windowHits, windowMisses, rate, backend.hitRate()));

                    lastHits = hits;
                    lastMisses = misses;
                } catch (Throwable t) {
                    log.warn("Stats reporter error", t);
                }
            }
        }, windowSeconds, windowSeconds, TimeUnit.SECONDS);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error during shutdown", e);
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
