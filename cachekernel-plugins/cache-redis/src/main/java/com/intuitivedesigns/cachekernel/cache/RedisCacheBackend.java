/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.cache;

import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.core.BackendUnavailableException;
import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheException;
import com.intuitivedesigns.cachekernel.core.KeySpace;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Redis-backed cache.
 * Features:
 * - JedisPool for concurrent callers; the pool's socket timeout bounds every call
 * - Nil replies map to a miss, every other failure to a {@link CacheException}
 * - clear(pattern) walks the keyspace with SCAN and deletes key by key (never KEYS, never atomic)
 * - ping() and connection failures drive {@link #isAvailable()}
 * - While unavailable, operations fail fast; one caller per recheck interval pings and, on success, restores service
 * - Rate-limited error logging
 */
public final class RedisCacheBackend implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheBackend.class);

    private static final long ERROR_LOG_INTERVAL_MS = 10_000L;
    private static final Duration DEFAULT_RECHECK_INTERVAL = Duration.ofSeconds(5);

    private final JedisPool pool;
    private final KeySpace keys;
    private final int scanCount;
    private final MetricsRuntime metrics;
    private final Duration recheckInterval;
    private final Clock clock;

    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicLong nextRecheckAtMs = new AtomicLong(0);
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public RedisCacheBackend(JedisPool pool, String keyPrefix, int scanCount, MetricsRuntime metrics) {
        this(pool, keyPrefix, scanCount, DEFAULT_RECHECK_INTERVAL, Clock.systemUTC(), metrics);
    }

    public RedisCacheBackend(JedisPool pool, String keyPrefix, int scanCount,
                             Duration recheckInterval, Clock clock, MetricsRuntime metrics) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.keys = new KeySpace(keyPrefix);
        this.scanCount = Math.max(1, scanCount);
        this.recheckInterval = Objects.requireNonNull(recheckInterval, "recheckInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    /**
     * Factory: builds the pool from settings. Does not contact the server.
     */
    public static RedisCacheBackend fromSettings(CacheSettings settings, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        if (settings.remoteUrl == null) {
            throw new IllegalArgumentException("Redis backend requires cache.remote.url");
        }

        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(settings.poolMaxTotal);
        poolConfig.setMaxIdle(settings.poolMaxIdle);
        poolConfig.setMinIdle(settings.poolMinIdle);
        poolConfig.setTestOnBorrow(false); // fast borrow
        poolConfig.setTestWhileIdle(true); // health check in background
        poolConfig.setMinEvictableIdleDuration(settings.poolIdleTimeout);
        poolConfig.setTimeBetweenEvictionRuns(Duration.ofSeconds(30));
        poolConfig.setMaxWait(settings.remoteTimeout);

        final int timeoutMs = (int) Math.min(Integer.MAX_VALUE, settings.remoteTimeout.toMillis());
        JedisPool pool = new JedisPool(poolConfig, settings.remoteUri(), timeoutMs);

        log.info("Redis cache configured: {} (pool {}/{}/{}, timeout {}ms)",
                CacheSettings.maskUrl(settings.remoteUrl), settings.poolMinIdle, settings.poolMaxIdle,
                settings.poolMaxTotal, timeoutMs);

        return new RedisCacheBackend(pool, settings.keyPrefix, settings.scanCount,
                settings.remoteRecheckInterval, Clock.systemUTC(), metrics);
    }

    @Override
    public Optional<byte[]> get(String key) throws CacheException {
        ensureReachable("get", key);
        try (Jedis jedis = pool.getResource()) {
            byte[] raw = jedis.get(encode(keys.apply(key)));
            return Optional.ofNullable(raw);
        } catch (JedisException e) {
            throw failure("get", key, e);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws CacheException {
        Objects.requireNonNull(value, "value");
        ensureReachable("set", key);
        try (Jedis jedis = pool.getResource()) {
            final byte[] k = encode(keys.apply(key));
            if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                // Atomic Set-with-Expiry
                // PSETEX rejects 0; sub-millisecond TTLs still expire
                jedis.psetex(k, Math.max(1L, ttl.toMillis()), value);
            } else {
                jedis.set(k, value);
            }
        } catch (JedisException e) {
            throw failure("set", key, e);
        }
    }

    @Override
    public void delete(String key) throws CacheException {
        ensureReachable("delete", key);
        try (Jedis jedis = pool.getResource()) {
            jedis.del(keys.apply(key));
        } catch (JedisException e) {
            throw failure("delete", key, e);
        }
    }

    @Override
    public boolean exists(String key) throws CacheException {
        ensureReachable("exists", key);
        try (Jedis jedis = pool.getResource()) {
            return jedis.exists(keys.apply(key));
        } catch (JedisException e) {
            throw failure("exists", key, e);
        }
    }

    @Override
    public void clear(String pattern) throws CacheException {
        ensureReachable("clear", pattern);
        final String stored = keys.apply(pattern);

        try (Jedis jedis = pool.getResource()) {
            if (!KeySpace.isPrefixPattern(stored)) {
                jedis.del(stored);
                return;
            }

            final String literal = stored.substring(0, stored.length() - 1);
            final ScanParams params = new ScanParams().match(escapeGlob(literal) + KeySpace.WILDCARD).count(scanCount);

            String cursor = ScanParams.SCAN_POINTER_START;
            long deleted = 0;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                for (String k : page.getResult()) {
                    deleted += jedis.del(k);
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));

            log.debug("Cleared {} keys matching '{}'", deleted, stored);
        } catch (JedisException e) {
            throw failure("clear", pattern, e);
        }
    }

    @Override
    public void ping() throws CacheException {
        try (Jedis jedis = pool.getResource()) {
            jedis.ping();
            if (available.compareAndSet(false, true)) {
                log.info("Redis cache reachable again");
            }
        } catch (JedisException e) {
            markUnavailable(e);
            throw new BackendUnavailableException("ping", null, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return available.get() && !pool.isClosed();
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public void close() {
        if (!pool.isClosed()) {
            pool.close();
            log.info("Redis cache pool closed.");
        }
    }

    private CacheException failure(String op, String key, JedisException e) {
        metrics.counter("cache.errors");
        logRateLimited("Redis " + op + " failed key=" + key, e);
        if (e instanceof JedisConnectionException) {
            markUnavailable(e);
            return new BackendUnavailableException(op, key, e);
        }
        return new CacheException(op, key, e);
    }

    /**
     * Fails fast while the server is marked down. Once per recheck interval one caller pings instead;
     * a successful ping lets that caller (and everyone after it) through again.
     */
    private void ensureReachable(String op, String key) throws BackendUnavailableException {
        if (available.get()) return;

        final long now = clock.millis();
        final long due = nextRecheckAtMs.get();
        if (now < due || !nextRecheckAtMs.compareAndSet(due, now + recheckInterval.toMillis())) {
            metrics.counter("cache.remote.short.circuit");
            throw new BackendUnavailableException(op, key, "redis marked unavailable, skipping call");
        }

        try {
            ping();
        } catch (CacheException e) {
            throw new BackendUnavailableException(op, key, e.getCause() != null ? e.getCause() : e);
        }
    }

    private void markUnavailable(JedisException e) {
        nextRecheckAtMs.set(clock.millis() + recheckInterval.toMillis());
        if (available.compareAndSet(true, false)) {
            log.warn("Redis cache marked unavailable, rechecking every {}ms: {}", recheckInterval.toMillis(), e.getMessage());
        }
    }

    private void logRateLimited(String context, Throwable ex) {
        long now = System.currentTimeMillis();
        long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.error("{} (suppressed {} similar errors): {}", context, suppressed, ex.getMessage());
            } else {
                log.error("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrorLogs.increment();
            metrics.counter("cache.error.log.suppressed");
        }
    }

    /**
     * Escapes Redis glob metacharacters so the literal part of a pattern only matches itself.
     */
    static String escapeGlob(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static byte[] encode(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
