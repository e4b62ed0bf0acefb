/*
 * Copyright 2025 Steven Lopez
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.intuitivedesigns.cachekernel.aside.CacheAside;
import com.intuitivedesigns.cachekernel.config.BackendSelector;
import com.intuitivedesigns.cachekernel.config.CacheSettings;
import com.intuitivedesigns.cachekernel.health.CacheHealth;
import com.intuitivedesigns.cachekernel.health.ComponentStatus;
import com.intuitivedesigns.cachekernel.invalidation.InvalidationBus;
import com.intuitivedesigns.cachekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cachekernel.warming.CacheWarmer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The process-wide cache handle.
 * <p>
 * Built once at startup and handed to every collaborator; there is no static instance. It owns the selected
 * backend (wrapped in {@link InstrumentedCacheBackend}) together with the cache-aside loader, the warmer and the
 * invalidation bus that all share it.
 *
 * <p>Convenience operations here are fail-open: backend errors are logged and reported as a miss,
 * {@code false} or a no-op. Use {@link #backend()} for the raw contract.</p>
 */
public final class CacheKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheKernel.class);

    private final CacheSettings settings;
    private final InstrumentedCacheBackend backend;
    private final JsonCodec codec;
    private final CacheAside aside;
    private final CacheWarmer warmer;
    private final InvalidationBus invalidation;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CacheKernel(CacheSettings settings, CacheBackend backend, MetricsRuntime metrics) {
        this(settings, backend, metrics, new JsonCodec());
    }

    public CacheKernel(CacheSettings settings, CacheBackend backend, MetricsRuntime metrics, JsonCodec codec) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.backend = (backend instanceof InstrumentedCacheBackend)
                ? (InstrumentedCacheBackend) backend
                : new InstrumentedCacheBackend(Objects.requireNonNull(backend, "backend"), metrics);
        this.aside = new CacheAside(this.backend, codec, settings.asideWriteTimeout);
        this.warmer = CacheWarmer.fromSettings(this.backend, codec, settings);
        this.invalidation = new InvalidationBus(this.backend);
    }

    /**
     * Selects a backend from settings (see {@link BackendSelector}) and wires everything around it.
     */
    public static CacheKernel start(CacheSettings settings, MetricsRuntime metrics) {
        final CacheBackend selected = new BackendSelector().initialize(settings, metrics);
        log.info("Cache kernel started: backend={} available={}", selected.name(), selected.isAvailable());
        return new CacheKernel(settings, selected, metrics);
    }

    // --- Components ---

    public CacheSettings settings() { return settings; }
    public InstrumentedCacheBackend backend() { return backend; }
    public JsonCodec codec() { return codec; }
    public CacheAside aside() { return aside; }
    public CacheWarmer warmer() { return warmer; }
    public InvalidationBus invalidation() { return invalidation; }

    public boolean isAvailable() {
        return backend.isAvailable();
    }

    public ComponentStatus health() {
        return CacheHealth.check(backend);
    }

    public Duration ttlFor(String domain) {
        return settings.ttlFor(domain);
    }

    // --- Fail-open operations ---

    public Optional<byte[]> get(String key) {
        try {
            return backend.get(key);
        } catch (CacheException e) {
            log.debug("Cache get failed key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return false if the write failed (already logged)
     */
    public boolean set(String key, byte[] value, Duration ttl) {
        try {
            backend.set(key, value, ttl);
            return true;
        } catch (CacheException e) {
            log.warn("Cache set failed key={}: {}", key, e.getMessage());
            return false;
        }
    }

    public <T> Optional<T> getJson(String key, Class<T> type) {
        return getJson(key, codec.type(type));
    }

    public <T> Optional<T> getJson(String key, TypeReference<T> type) {
        return getJson(key, codec.type(type));
    }

    /**
     * @throws SerializationException if {@code value} cannot be encoded; backend failures are only logged
     */
    public boolean setJson(String key, Object value, Duration ttl) throws SerializationException {
        return set(key, codec.encode(key, value), ttl);
    }

    public void invalidate(String key) {
        try {
            backend.delete(key);
        } catch (CacheException e) {
            log.debug("Failed to invalidate cache key={}: {}", key, e.getMessage());
        }
    }

    public void invalidatePattern(String pattern) {
        try {
            backend.clear(pattern);
        } catch (CacheException e) {
            log.debug("Failed to invalidate cache pattern={}: {}", pattern, e.getMessage());
        }
    }

    /**
     * @return false when absent, expired, or the backend failed
     */
    public boolean exists(String key) {
        try {
            return backend.exists(key);
        } catch (CacheException e) {
            return false;
        }
    }

    /**
     * Best-effort set-if-absent: check then write, not atomic across callers.
     *
     * @return true if the value was written
     */
    public boolean setIfNotExists(String key, byte[] value, Duration ttl) {
        if (exists(key)) {
            return false;
        }
        return set(key, value, ttl);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        aside.close();
        backend.close();
        log.info("Cache kernel closed. hits={} misses={} hitRate={}%",
                backend.hits(), backend.misses(), String.format("%.2f", backend.hitRate()));
    }

    private <T> Optional<T> getJson(String key, JavaType type) {
        final Optional<byte[]> raw = get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(codec.decode(key, raw.get(), type));
        } catch (SerializationException e) {
            log.debug("Treating undecodable cache value as miss key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
