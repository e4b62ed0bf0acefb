/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.config;

import com.intuitivedesigns.cachekernel.core.BoundedPing;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheException;
import com.intuitivedesigns.cachekernel.core.NoopCacheBackend;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cachekernel.spi.CachePlugin;
import com.intuitivedesigns.cachekernel.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Chooses the cache backend once, at startup.
 * <ul>
 *   <li>disabled: no-op backend</li>
 *   <li>{@code REDIS} with a URL: remote backend if it answers a ping within {@code cache.remote.ping.timeout.ms},
 *       otherwise the in-memory backend</li>
 *   <li>anything else: the plugin registered under {@code cache.type} (in-memory by default)</li>
 * </ul>
 * There is no failback to the remote backend later on.
 */
public final class BackendSelector {

    private static final Logger log = LoggerFactory.getLogger(BackendSelector.class);

    private static final String KEY_CACHE_TYPE = "cache.type";

    private final ServicePluginRegistry<CachePlugin> plugins;

    public BackendSelector() {
        this(new ServicePluginRegistry<>(CachePlugin.class));
    }

    public BackendSelector(ServicePluginRegistry<CachePlugin> plugins) {
        this.plugins = Objects.requireNonNull(plugins, "plugins");
    }

    public CacheBackend initialize(CacheSettings settings, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(metrics, "metrics");

        if (!settings.enabled) {
            log.info("Cache disabled, using no-op cache");
            return new NoopCacheBackend();
        }

        if (CacheSettings.TYPE_REDIS.equals(settings.type)) {
            if (!settings.remoteRequested()) {
                log.warn("cache.type=REDIS but cache.remote.url is empty, using in-memory cache");
                return memory(settings, metrics);
            }
            return remoteOrMemory(settings, metrics);
        }

        final CacheBackend backend = create(plugins.require(settings.type, KEY_CACHE_TYPE), settings, metrics);
        log.info("Using {} cache", backend.name());
        return backend;
    }

    public void logAvailablePlugins() {
        log.info("Cache backends available: {}", plugins.availableIds());
    }

    private CacheBackend remoteOrMemory(CacheSettings settings, MetricsRuntime metrics) {
        final String target = CacheSettings.maskUrl(settings.remoteUrl);

        final CacheBackend remote;
        try {
            remote = create(plugins.require(CacheSettings.TYPE_REDIS, KEY_CACHE_TYPE), settings, metrics);
        } catch (RuntimeException e) {
            log.warn("Failed to create Redis cache ({}), falling back to in-memory cache: {}", target, e.getMessage());
            return memory(settings, metrics);
        }

        try {
            BoundedPing.ping(remote, settings.pingTimeout);
        } catch (CacheException e) {
            log.warn("Redis ping failed ({}), falling back to in-memory cache: {}", target, e.getMessage());
            remote.close();
            return memory(settings, metrics);
        }

        log.info("Redis cache initialized: {}", target);
        return remote;
    }

    private CacheBackend memory(CacheSettings settings, MetricsRuntime metrics) {
        final CacheBackend backend = create(plugins.require(CacheSettings.TYPE_MEMORY, KEY_CACHE_TYPE), settings, metrics);
        log.info("Using in-memory cache");
        return backend;
    }

    private static CacheBackend create(CachePlugin plugin, CacheSettings settings, MetricsRuntime metrics) {
        try {
            return plugin.create(settings, metrics);
        } catch (Throwable t) {
            final String pluginId;
            try {
                pluginId = String.valueOf(plugin.id());
            } catch (Throwable ignored) {
                throw new IllegalStateException("Failed creating cache backend (plugin id unavailable)", t);
            }
            throw new IllegalStateException("Failed creating cache backend [" + pluginId + "]", t);
        }
    }
}
