/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

/**
 * Flat key/value configuration source.
 * <p>
 * Built once at process start and handed to whoever needs it; there is no global instance.
 * {@link #load()} reads the file named by {@code -Dck.config.path} or ENV {@code CK_CONFIG_PATH}
 * and then applies the well-known cache environment variables on top.
 */
public final class KernelConfig {

    private static final Logger log = LoggerFactory.getLogger(KernelConfig.class);

    static final String SYS_CONFIG_PATH = "ck.config.path";
    static final String ENV_CONFIG_PATH = "CK_CONFIG_PATH";

    // ENV name -> config key
    private static final Map<String, String> ENV_OVERRIDES = Map.ofEntries(
            Map.entry("CACHE_ENABLED", CacheSettings.KEY_ENABLED),
            Map.entry("CACHE_TYPE", CacheSettings.KEY_TYPE),
            Map.entry("CACHE_KEY_PREFIX", CacheSettings.KEY_PREFIX),
            Map.entry("REDIS_URL", CacheSettings.KEY_REMOTE_URL),
            Map.entry("REDIS_POOL_SIZE", CacheSettings.KEY_POOL_MAX),
            Map.entry("REDIS_MIN_IDLE_CONNS", CacheSettings.KEY_POOL_MIN_IDLE),
            Map.entry("REDIS_MAX_IDLE_CONNS", CacheSettings.KEY_POOL_MAX_IDLE),
            Map.entry("CACHE_MEMORY_MAX_SIZE", CacheSettings.KEY_MEMORY_MAX_SIZE),
            // Per-domain TTLs, in seconds
            Map.entry("CACHE_DEFAULT_TTL", ttlKey(CacheDomain.DEFAULT)),
            Map.entry("CACHE_HEALTH_CHECK_TTL", ttlKey(CacheDomain.HEALTH_CHECK)),
            Map.entry("CACHE_USER_PROFILE_TTL", ttlKey(CacheDomain.USER_PROFILE)),
            Map.entry("CACHE_SESSION_TTL", ttlKey(CacheDomain.SESSION)),
            Map.entry("CACHE_ORGANIZATION_TTL", ttlKey(CacheDomain.ORGANIZATION)),
            Map.entry("CACHE_MEMBERSHIP_TTL", ttlKey(CacheDomain.MEMBERSHIP))
    );

    private final Properties props;

    private KernelConfig(Properties props) {
        this.props = props;
    }

    public static KernelConfig load() {
        return load(System::getenv);
    }

    static KernelConfig load(Function<String, String> env) {
        final Properties props = new Properties();

        // 1. System property first, then environment
        String path = System.getProperty(SYS_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = env.apply(ENV_CONFIG_PATH);
        }

        if (path != null && !path.isBlank()) {
            log.info("Loading configuration from: {}", path);
            try (InputStream is = new FileInputStream(path)) {
                props.load(is);
                log.info("Loaded {} properties.", props.size());
            } catch (IOException e) {
                log.error("Failed to load config file: {}", path, e);
            }
        } else {
            log.warn("No configuration file specified (-D{} or {}). Using defaults and environment.",
                    SYS_CONFIG_PATH, ENV_CONFIG_PATH);
        }

        applyEnvironment(props, env);
        return new KernelConfig(props);
    }

    public static KernelConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new KernelConfig(copy);
    }

    public static KernelConfig fromMap(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties props = new Properties();
        source.forEach(props::setProperty);
        return new KernelConfig(props);
    }

    public static KernelConfig empty() {
        return new KernelConfig(new Properties());
    }

    private static void applyEnvironment(Properties props, Function<String, String> env) {
        for (Map.Entry<String, String> e : ENV_OVERRIDES.entrySet()) {
            final String value = env.apply(e.getKey());
            if (value == null || value.isBlank()) continue;
            props.setProperty(e.getValue(), value.trim());
        }

        // A Redis URL in the environment implies the remote backend.
        final String redisUrl = env.apply("REDIS_URL");
        if (redisUrl != null && !redisUrl.isBlank()) {
            props.setProperty(CacheSettings.KEY_TYPE, "REDIS");
        }

        final String type = props.getProperty(CacheSettings.KEY_TYPE);
        if (type != null) {
            props.setProperty(CacheSettings.KEY_TYPE, type.trim().toUpperCase(Locale.ROOT));
        }
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }

    private static String ttlKey(String domain) {
        return CacheSettings.KEY_TTL_PREFIX + domain + CacheSettings.KEY_TTL_SUFFIX;
    }
}
