/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.cache;

import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cachekernel.spi.CachePlugin;

/**
 * ID: REDIS
 * <p>
 * Requires {@code cache.remote.url}. Connectivity is verified by the caller, not here.
 */
public final class RedisCachePlugin implements CachePlugin {

    public static final String ID = CacheSettings.TYPE_REDIS;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheBackend create(CacheSettings settings, MetricsRuntime metrics) {
        return RedisCacheBackend.fromSettings(settings, metrics);
    }
}
