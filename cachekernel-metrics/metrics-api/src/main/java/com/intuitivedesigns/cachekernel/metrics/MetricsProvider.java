/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

/**
 * Service Provider Interface (SPI) for Metrics implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.cachekernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * The unique identifier for this provider (e.g., "PROMETHEUS", "NOOP").
     * <p>Matched against the {@code metrics.provider} configuration.
     */
    String id();

    /**
     * @return a runtime if this provider is the one selected, or {@code null} to be skipped.
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
