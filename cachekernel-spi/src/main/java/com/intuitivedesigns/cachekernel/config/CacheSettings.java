/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for a cache backend.
 * <p>
 * Built once from {@link KernelConfig}; backends copy what they need at construction.
 */
public final class CacheSettings {

    // ---- Config keys ----
    static final String KEY_ENABLED = "cache.enabled";
    static final String KEY_TYPE = "cache.type";
    static final String KEY_PREFIX = "cache.key.prefix";

    static final String KEY_REMOTE_URL = "cache.remote.url";
    static final String KEY_POOL_MAX = "cache.remote.pool.max";
    static final String KEY_POOL_MIN_IDLE = "cache.remote.pool.min.idle";
    static final String KEY_POOL_MAX_IDLE = "cache.remote.pool.max.idle";
    static final String KEY_POOL_IDLE_TIMEOUT_MS = "cache.remote.pool.idle.timeout.ms";
    static final String KEY_REMOTE_TIMEOUT_MS = "cache.remote.timeout.ms";
    static final String KEY_PING_TIMEOUT_MS = "cache.remote.ping.timeout.ms";
    static final String KEY_SCAN_COUNT = "cache.remote.scan.count";
    static final String KEY_RECHECK_INTERVAL_MS = "cache.remote.recheck.interval.ms";

    static final String KEY_MEMORY_MAX_SIZE = "cache.memory.max.size";
    static final String KEY_MEMORY_CLEANUP_MS = "cache.memory.cleanup.interval.ms";

    static final String KEY_TTL_PREFIX = "cache.ttl.";
    static final String KEY_TTL_SUFFIX = ".seconds";

    static final String KEY_ASIDE_WRITE_TIMEOUT_MS = "cache.aside.write.timeout.ms";

    static final String KEY_WARMING_ENABLED = "cache.warming.enabled";
    static final String KEY_WARMING_CONCURRENCY = "cache.warming.concurrency";
    static final String KEY_WARMING_TIMEOUT_MS = "cache.warming.timeout.ms";

    // ---- Defaults ----
    public static final String TYPE_MEMORY = "MEMORY";
    public static final String TYPE_REDIS = "REDIS";
    private static final String TYPE_REMOTE_ALIAS = "REMOTE";

    private static final String DEFAULT_PREFIX = "app";
    private static final int DEFAULT_POOL_MAX = 10;
    private static final int DEFAULT_POOL_MIN_IDLE = 2;
    private static final int DEFAULT_POOL_MAX_IDLE = 5;
    private static final long DEFAULT_POOL_IDLE_TIMEOUT_MS = 300_000L;
    private static final int DEFAULT_REMOTE_TIMEOUT_MS = 2_000;
    private static final long DEFAULT_PING_TIMEOUT_MS = 5_000L;
    private static final int DEFAULT_SCAN_COUNT = 100;
    private static final long DEFAULT_RECHECK_INTERVAL_MS = 5_000L;
    private static final int DEFAULT_MEMORY_MAX_SIZE = 10_000;
    private static final long DEFAULT_MEMORY_CLEANUP_MS = 60_000L;
    private static final long DEFAULT_ASIDE_WRITE_TIMEOUT_MS = 2_000L;
    private static final int DEFAULT_WARMING_CONCURRENCY = 5;
    private static final long DEFAULT_WARMING_TIMEOUT_MS = 30_000L;

    private static final Map<String, Duration> DEFAULT_TTLS;

    static {
        Map<String, Duration> m = new LinkedHashMap<>();
        m.put(CacheDomain.DEFAULT, Duration.ofMinutes(5));
        m.put(CacheDomain.HEALTH_CHECK, Duration.ofSeconds(30));
        m.put(CacheDomain.USER_PROFILE, Duration.ofMinutes(2));
        m.put(CacheDomain.SESSION, Duration.ofMinutes(15));
        m.put(CacheDomain.ORGANIZATION, Duration.ofMinutes(5));
        m.put(CacheDomain.MEMBERSHIP, Duration.ofMinutes(5));
        DEFAULT_TTLS = Collections.unmodifiableMap(m);
    }

    // ---- Public Immutable Fields ----
    public final boolean enabled;
    public final String type;
    public final String keyPrefix;

    public final String remoteUrl;
    public final int poolMaxTotal;
    public final int poolMinIdle;
    public final int poolMaxIdle;
    public final Duration poolIdleTimeout;
    public final Duration remoteTimeout;
    public final Duration pingTimeout;
    public final int scanCount;
    public final Duration remoteRecheckInterval;

    public final int memoryMaxSize;
    public final Duration memoryCleanupInterval;

    public final Map<String, Duration> ttls;

    public final Duration asideWriteTimeout;

    public final boolean warmingEnabled;
    public final int warmingConcurrency;
    public final Duration warmingTimeout;

    private CacheSettings(Builder b) {
        this.enabled = b.enabled;
        this.type = b.type;
        this.keyPrefix = b.keyPrefix;
        this.remoteUrl = b.remoteUrl;
        this.poolMaxTotal = b.poolMaxTotal;
        this.poolMinIdle = b.poolMinIdle;
        this.poolMaxIdle = b.poolMaxIdle;
        this.poolIdleTimeout = b.poolIdleTimeout;
        this.remoteTimeout = b.remoteTimeout;
        this.pingTimeout = b.pingTimeout;
        this.scanCount = b.scanCount;
        this.remoteRecheckInterval = b.remoteRecheckInterval;
        this.memoryMaxSize = b.memoryMaxSize;
        this.memoryCleanupInterval = b.memoryCleanupInterval;
        this.ttls = Collections.unmodifiableMap(new LinkedHashMap<>(b.ttls));
        this.asideWriteTimeout = b.asideWriteTimeout;
        this.warmingEnabled = b.warmingEnabled;
        this.warmingConcurrency = b.warmingConcurrency;
        this.warmingTimeout = b.warmingTimeout;
    }

    public static CacheSettings from(KernelConfig config) {
        Objects.requireNonNull(config, "config");

        Builder b = builder()
                .enabled(config.getBoolean(KEY_ENABLED, false))
                .type(config.getString(KEY_TYPE, TYPE_MEMORY))
                .keyPrefix(config.getString(KEY_PREFIX, DEFAULT_PREFIX))
                .remoteUrl(config.getString(KEY_REMOTE_URL, null))
                .poolMaxTotal(config.getInt(KEY_POOL_MAX, DEFAULT_POOL_MAX))
                .poolMinIdle(config.getInt(KEY_POOL_MIN_IDLE, DEFAULT_POOL_MIN_IDLE))
                .poolMaxIdle(config.getInt(KEY_POOL_MAX_IDLE, DEFAULT_POOL_MAX_IDLE))
                .poolIdleTimeout(Duration.ofMillis(config.getLong(KEY_POOL_IDLE_TIMEOUT_MS, DEFAULT_POOL_IDLE_TIMEOUT_MS)))
                .remoteTimeout(Duration.ofMillis(config.getInt(KEY_REMOTE_TIMEOUT_MS, DEFAULT_REMOTE_TIMEOUT_MS)))
                .pingTimeout(Duration.ofMillis(config.getLong(KEY_PING_TIMEOUT_MS, DEFAULT_PING_TIMEOUT_MS)))
                .scanCount(config.getInt(KEY_SCAN_COUNT, DEFAULT_SCAN_COUNT))
                .remoteRecheckInterval(Duration.ofMillis(config.getLong(KEY_RECHECK_INTERVAL_MS, DEFAULT_RECHECK_INTERVAL_MS)))
                .memoryMaxSize(config.getInt(KEY_MEMORY_MAX_SIZE, DEFAULT_MEMORY_MAX_SIZE))
                .memoryCleanupInterval(Duration.ofMillis(config.getLong(KEY_MEMORY_CLEANUP_MS, DEFAULT_MEMORY_CLEANUP_MS)))
                .asideWriteTimeout(Duration.ofMillis(config.getLong(KEY_ASIDE_WRITE_TIMEOUT_MS, DEFAULT_ASIDE_WRITE_TIMEOUT_MS)))
                .warmingEnabled(config.getBoolean(KEY_WARMING_ENABLED, true))
                .warmingConcurrency(config.getInt(KEY_WARMING_CONCURRENCY, DEFAULT_WARMING_CONCURRENCY))
                .warmingTimeout(Duration.ofMillis(config.getLong(KEY_WARMING_TIMEOUT_MS, DEFAULT_WARMING_TIMEOUT_MS)));

        // --- TTL parsing: cache.ttl.<domain>.seconds ---
        for (String key : config.keys()) {
            if (!key.startsWith(KEY_TTL_PREFIX) || !key.endsWith(KEY_TTL_SUFFIX)) continue;
            final String domain = key.substring(KEY_TTL_PREFIX.length(), key.length() - KEY_TTL_SUFFIX.length()).trim();
            if (domain.isEmpty()) continue;

            final long seconds = config.getLong(key, -1L);
            if (seconds > 0) {
                b.ttl(domain, Duration.ofSeconds(seconds));
            }
        }

        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .enabled(enabled)
                .type(type)
                .keyPrefix(keyPrefix)
                .remoteUrl(remoteUrl)
                .poolMaxTotal(poolMaxTotal)
                .poolMinIdle(poolMinIdle)
                .poolMaxIdle(poolMaxIdle)
                .poolIdleTimeout(poolIdleTimeout)
                .remoteTimeout(remoteTimeout)
                .pingTimeout(pingTimeout)
                .scanCount(scanCount)
                .remoteRecheckInterval(remoteRecheckInterval)
                .memoryMaxSize(memoryMaxSize)
                .memoryCleanupInterval(memoryCleanupInterval)
                .asideWriteTimeout(asideWriteTimeout)
                .warmingEnabled(warmingEnabled)
                .warmingConcurrency(warmingConcurrency)
                .warmingTimeout(warmingTimeout);
        ttls.forEach(b::ttl);
        return b;
    }

    /**
     * @return the TTL configured for {@code domain}, or the default TTL when the domain is unknown.
     */
    public Duration ttlFor(String domain) {
        if (domain != null) {
            Duration d = ttls.get(domain.trim().toLowerCase(Locale.ROOT));
            if (d != null) return d;
        }
        return defaultTtl();
    }

    public Duration defaultTtl() {
        return ttls.get(CacheDomain.DEFAULT);
    }

    /**
     * @return true when a remote backend was requested and a connection target is present.
     */
    public boolean remoteRequested() {
        return TYPE_REDIS.equals(type) && remoteUrl != null;
    }

    public URI remoteUri() {
        return remoteUrl == null ? null : URI.create(remoteUrl);
    }

    @Override
    public String toString() {
        return "CacheSettings{" +
                "enabled=" + enabled +
                ", type='" + type + '\'' +
                ", keyPrefix='" + keyPrefix + '\'' +
                ", remoteUrl='" + maskUrl(remoteUrl) + '\'' +
                ", pool=" + poolMinIdle + "/" + poolMaxIdle + "/" + poolMaxTotal +
                ", remoteTimeout=" + remoteTimeout +
                ", memoryMaxSize=" + memoryMaxSize +
                ", memoryCleanupInterval=" + memoryCleanupInterval +
                ", ttls=" + ttls +
                ", warming=" + (warmingEnabled ? warmingConcurrency + "@" + warmingTimeout : "off") +
                '}';
    }

    // --- Helpers ---

    public static String maskUrl(String url) {
        if (url == null) return null;
        int at = url.indexOf('@');
        int scheme = url.indexOf("://");
        if (at < 0 || scheme < 0 || at < scheme) return url;
        return url.substring(0, scheme + 3) + "****" + url.substring(at);
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeType(String raw) {
        String n = normalize(raw);
        if (n == null) return TYPE_MEMORY;
        String upper = n.toUpperCase(Locale.ROOT);
        return TYPE_REMOTE_ALIAS.equals(upper) ? TYPE_REDIS : upper;
    }

    private static URI validateRemoteUrl(String url) {
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ConfigurationException(KEY_REMOTE_URL, "malformed connection target", e);
        }
        final String scheme = uri.getScheme();
        if (scheme == null || !("redis".equalsIgnoreCase(scheme) || "rediss".equalsIgnoreCase(scheme))) {
            throw new ConfigurationException(KEY_REMOTE_URL, "expected redis:// or rediss:// but got '" + maskUrl(url) + "'");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ConfigurationException(KEY_REMOTE_URL, "missing host in '" + maskUrl(url) + "'");
        }
        if (uri.getPort() == 0 || uri.getPort() > 65_535) {
            throw new ConfigurationException(KEY_REMOTE_URL, "invalid port in '" + maskUrl(url) + "'");
        }
        final String path = uri.getPath();
        if (path != null && path.length() > 1) {
            try {
                Integer.parseInt(path.substring(1));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(KEY_REMOTE_URL, "database index must be numeric in '" + maskUrl(url) + "'", e);
            }
        }
        return uri;
    }

    private static int requirePositive(String key, int value) {
        if (value <= 0) throw new ConfigurationException(key, "must be > 0 but was " + value);
        return value;
    }

    private static int requireNonNegative(String key, int value) {
        if (value < 0) throw new ConfigurationException(key, "must be >= 0 but was " + value);
        return value;
    }

    private static Duration requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(key, "must be a positive duration but was " + value);
        }
        return value;
    }

    public static final class Builder {
        private boolean enabled = false;
        private String type = TYPE_MEMORY;
        private String keyPrefix = DEFAULT_PREFIX;
        private String remoteUrl;
        private int poolMaxTotal = DEFAULT_POOL_MAX;
        private int poolMinIdle = DEFAULT_POOL_MIN_IDLE;
        private int poolMaxIdle = DEFAULT_POOL_MAX_IDLE;
        private Duration poolIdleTimeout = Duration.ofMillis(DEFAULT_POOL_IDLE_TIMEOUT_MS);
        private Duration remoteTimeout = Duration.ofMillis(DEFAULT_REMOTE_TIMEOUT_MS);
        private Duration pingTimeout = Duration.ofMillis(DEFAULT_PING_TIMEOUT_MS);
        private int scanCount = DEFAULT_SCAN_COUNT;
        private Duration remoteRecheckInterval = Duration.ofMillis(DEFAULT_RECHECK_INTERVAL_MS);
        private int memoryMaxSize = DEFAULT_MEMORY_MAX_SIZE;
        private Duration memoryCleanupInterval = Duration.ofMillis(DEFAULT_MEMORY_CLEANUP_MS);
        private final Map<String, Duration> ttls = new LinkedHashMap<>(DEFAULT_TTLS);
        private Duration asideWriteTimeout = Duration.ofMillis(DEFAULT_ASIDE_WRITE_TIMEOUT_MS);
        private boolean warmingEnabled = true;
        private int warmingConcurrency = DEFAULT_WARMING_CONCURRENCY;
        private Duration warmingTimeout = Duration.ofMillis(DEFAULT_WARMING_TIMEOUT_MS);

        private Builder() {}

        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder type(String type) { this.type = type; return this; }
        public Builder keyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; return this; }
        public Builder remoteUrl(String remoteUrl) { this.remoteUrl = remoteUrl; return this; }
        public Builder poolMaxTotal(int v) { this.poolMaxTotal = v; return this; }
        public Builder poolMinIdle(int v) { this.poolMinIdle = v; return this; }
        public Builder poolMaxIdle(int v) { this.poolMaxIdle = v; return this; }
        public Builder poolIdleTimeout(Duration v) { this.poolIdleTimeout = v; return this; }
        public Builder remoteTimeout(Duration v) { this.remoteTimeout = v; return this; }
        public Builder pingTimeout(Duration v) { this.pingTimeout = v; return this; }
        public Builder scanCount(int v) { this.scanCount = v; return this; }
        public Builder remoteRecheckInterval(Duration v) { this.remoteRecheckInterval = v; return this; }
        public Builder memoryMaxSize(int v) { this.memoryMaxSize = v; return this; }
        public Builder memoryCleanupInterval(Duration v) { this.memoryCleanupInterval = v; return this; }
        public Builder asideWriteTimeout(Duration v) { this.asideWriteTimeout = v; return this; }
        public Builder warmingEnabled(boolean v) { this.warmingEnabled = v; return this; }
        public Builder warmingConcurrency(int v) { this.warmingConcurrency = v; return this; }
        public Builder warmingTimeout(Duration v) { this.warmingTimeout = v; return this; }

        public Builder ttl(String domain, Duration ttl) {
            Objects.requireNonNull(domain, "domain");
            this.ttls.put(domain.trim().toLowerCase(Locale.ROOT), requirePositive(KEY_TTL_PREFIX + domain + KEY_TTL_SUFFIX, ttl));
            return this;
        }

        public Builder defaultTtl(Duration ttl) {
            return ttl(CacheDomain.DEFAULT, ttl);
        }

        public CacheSettings build() {
            this.type = normalizeType(type);
            final String prefix = keyPrefix == null ? "" : keyPrefix.trim();
            this.keyPrefix = prefix;

            this.remoteUrl = normalize(remoteUrl);
            if (remoteUrl != null) {
                validateRemoteUrl(remoteUrl);
            }

            requirePositive(KEY_POOL_MAX, poolMaxTotal);
            requireNonNegative(KEY_POOL_MIN_IDLE, poolMinIdle);
            requireNonNegative(KEY_POOL_MAX_IDLE, poolMaxIdle);
            if (poolMinIdle > poolMaxIdle) {
                throw new ConfigurationException(KEY_POOL_MIN_IDLE, "min idle (" + poolMinIdle + ") exceeds max idle (" + poolMaxIdle + ")");
            }
            requirePositive(KEY_POOL_IDLE_TIMEOUT_MS, poolIdleTimeout);
            requirePositive(KEY_REMOTE_TIMEOUT_MS, remoteTimeout);
            requirePositive(KEY_PING_TIMEOUT_MS, pingTimeout);
            requirePositive(KEY_SCAN_COUNT, scanCount);
            requirePositive(KEY_RECHECK_INTERVAL_MS, remoteRecheckInterval);
            requirePositive(KEY_MEMORY_CLEANUP_MS, memoryCleanupInterval);
            requirePositive(KEY_ASIDE_WRITE_TIMEOUT_MS, asideWriteTimeout);
            requirePositive(KEY_WARMING_CONCURRENCY, warmingConcurrency);
            requirePositive(KEY_WARMING_TIMEOUT_MS, warmingTimeout);

            return new CacheSettings(this);
        }
    }
}
