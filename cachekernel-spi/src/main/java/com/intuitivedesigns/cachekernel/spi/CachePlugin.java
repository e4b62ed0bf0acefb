/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.spi;

import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;

/**
 * SPI factory for cache backends.
 * <p>
 * Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.cachekernel.spi.CachePlugin}.
 *
 * Example IDs: "MEMORY", "REDIS", "NOOP"
 */
public interface CachePlugin extends ServicePlugin {

    /**
     * Creates a new backend. The caller owns the result and must close it.
     *
     * @throws Exception if the backend cannot be constructed
     */
    CacheBackend create(CacheSettings settings, MetricsRuntime metrics) throws Exception;
}
