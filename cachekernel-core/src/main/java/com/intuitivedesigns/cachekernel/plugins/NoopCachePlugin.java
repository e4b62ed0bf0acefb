/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.plugins;

import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.NoopCacheBackend;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cachekernel.spi.CachePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A No-Op (pass-through) cache.
 * Selectable explicitly with {@code cache.type=NOOP}, e.g. for benchmarking the source of truth.
 * <p>
 * ID: NOOP
 */
public final class NoopCachePlugin implements CachePlugin {

    public static final String ID = "NOOP";
    private static final Logger log = LoggerFactory.getLogger(NoopCachePlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheBackend create(CacheSettings settings, MetricsRuntime metrics) {
        log.info("Creating No-Op Cache (Stateless)");
        return new NoopCacheBackend();
    }
}
