/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

/**
 * The vendor-agnostic contract for observability.
 *
 * Backends and decorators record through this interface; the concrete registry
 * (Micrometer, Prometheus, nothing at all) is chosen at startup.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationNanos) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }

    static MetricsRuntime noop() {
        return Noop.INSTANCE;
    }

    final class Noop implements MetricsRuntime {
        private static final Noop INSTANCE = new Noop();

        // Sentinel instead of null so "instanceof" checks downstream stay safe
        private final Object sentinelRegistry = new Object();

        private Noop() {}

        @Override
        public Object registry() {
            return sentinelRegistry;
        }
    }
}
