/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite Registry (one or more concrete registries: Simple, Prometheus, ...)
 * - Stateful "Push" Gauges (maps generic gauge calls to atomic state holders)
 * - Optional close hook for resources owned alongside the registry (e.g. a scrape endpoint)
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final String type;
    private final AutoCloseable onClose;

    // State storage for "Push" gauges (Micrometer defaults to "Pull/Poll" gauges)
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    /**
     * In-memory runtime backed by a {@link SimpleMeterRegistry}.
     */
    public MicrometerMetricsRuntime() {
        this(new SimpleMeterRegistry(), "MICROMETER", null);
    }

    public MicrometerMetricsRuntime(MeterRegistry backing, String type, AutoCloseable onClose) {
        Objects.requireNonNull(backing, "backing");
        this.registry = new CompositeMeterRegistry();
        this.registry.add(backing);
        this.type = (type == null || type.isBlank()) ? "MICROMETER" : type;
        this.onClose = onClose;
    }

    /**
     * Adds a specific registry (e.g., Prometheus) to the composite.
     */
    public void addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationNanos) {
        registry.timer(name).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        // computeIfAbsent is atomic: ensures we register the gauge exactly once
        AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get)
                    .register(registry);
            return newState;
        });

        state.set(value);
    }

    @Override
    public void close() {
        registry.close();
        if (onClose != null) {
            try {
                onClose.close();
            } catch (Exception e) {
                log.warn("Error closing metrics resources for {}", type, e);
            }
        }
        log.info("Metrics Runtime Closed ({}).", type);
    }

    /**
     * Lightweight Mutable Double for Gauge State.
     * Extends Number to satisfy Micrometer's functional interface requirements.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
