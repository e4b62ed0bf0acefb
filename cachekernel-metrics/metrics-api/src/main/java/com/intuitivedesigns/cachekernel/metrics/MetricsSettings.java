/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

import com.intuitivedesigns.cachekernel.config.KernelConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the Metrics Runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";
    private static final String KEY_CACHE_TYPE = "cache.type";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_CACHE_BACKEND = "memory";

    // ---- Public Immutable Fields ----
    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;
    /** Lower-cased {@code cache.type}; every meter carries it as the {@code cache.backend} tag. */
    public final String cacheBackend;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort, String cacheBackend) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
        this.cacheBackend = cacheBackend;
    }

    public static MetricsSettings from(KernelConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        // --- Tag Parsing ---
        final Map<String, String> tags = new LinkedHashMap<>();
        for (String k : config.keys()) {
            if (!k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            if (tagKey.isEmpty()) continue;

            final String val = normalize(config.getString(k, null));
            if (val == null) continue;

            tags.put(tagKey, val);
        }

        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 1, 65_535);
        final String backend = normalize(config.getString(KEY_CACHE_TYPE, null));

        return new MetricsSettings(
                provider == null ? DEFAULT_PROVIDER : provider,
                Collections.unmodifiableMap(tags),
                promPort,
                backend == null ? DEFAULT_CACHE_BACKEND : backend.toLowerCase(Locale.ROOT)
        );
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheusPort=" + prometheusPort +
                ", cacheBackend='" + cacheBackend + '\'' +
                '}';
    }

    // --- Helpers ---

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
