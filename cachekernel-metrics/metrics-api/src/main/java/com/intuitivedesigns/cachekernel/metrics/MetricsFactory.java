/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        return init(settings, ServiceLoader.load(MetricsProvider.class, resolveClassLoader()));
    }

    static MetricsRuntime init(MetricsSettings settings, Iterable<MetricsProvider> providers) {
        Objects.requireNonNull(settings, "settings");

        for (MetricsProvider p : providers) {
            try {
                // Providers check metrics.provider themselves and return null if they don't match.
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics Runtime initialized: {} ({})", rt.type(), p.getClass().getName());
                    return rt;
                }
            } catch (Throwable t) {
                // Throwable, not Exception: a provider with missing dependencies fails with LinkageError
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.info("Metrics disabled or no suitable provider found (NOOP active).");
        return MetricsRuntime.noop();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
