/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.cachekernel.spi;

import java.util.*;

/**
 * Universal Registry for SPI discovery.
 *
 * <p><b>Performance Note:</b> This class performs the expensive ServiceLoader
 * classpath scan <b>once</b> and caches the results. Subsequent lookups are O(1).</p>
 *
 * @param <T> The SPI interface type (e.g., CachePlugin.class)
 */
public final class ServicePluginRegistry<T extends ServicePlugin> {
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, resolveClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this(spiType, ServiceLoader.load(spiType, cl));
    }

    /**
     * Builds a registry from an explicit plugin list (embedding, tests).
     */
    public ServicePluginRegistry(Class<T> spiType, Iterable<? extends T> plugins) {
        Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : plugins) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName() + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    public T require(String id, String configKeyName) {
        String key = PluginIds.normalize(id);
        T plugin = byId.get(key);
        if (plugin == null) {
            throw new IllegalArgumentException("No plugin found for '" + configKeyName + "=" + id + "'. " + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : ServicePluginRegistry.class.getClassLoader();
    }
}
