/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.invalidation;

import com.intuitivedesigns.cachekernel.core.CacheBackend;
import com.intuitivedesigns.cachekernel.core.CacheException;
import com.intuitivedesigns.cachekernel.spi.InvalidationBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Applies invalidation events to the cache and optionally notifies connected clients.
 * <p>
 * The broadcaster is registered by the host after startup; until then broadcasts are skipped.
 * Failures are logged and never thrown back at the publisher.
 */
public final class InvalidationBus {

    private static final Logger log = LoggerFactory.getLogger(InvalidationBus.class);

    private final CacheBackend backend;
    private final Clock clock;
    private volatile InvalidationBroadcaster broadcaster;

    public InvalidationBus(CacheBackend backend) {
        this(backend, Clock.systemUTC());
    }

    public InvalidationBus(CacheBackend backend, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sets (or with {@code null}, removes) the outbound broadcaster.
     */
    public void registerBroadcaster(InvalidationBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
        log.info("Cache invalidation broadcaster {}", broadcaster == null ? "removed" : "registered");
    }

    public void publish(InvalidationEvent event) {
        Objects.requireNonNull(event, "event");

        for (String key : event.keys()) {
            try {
                backend.delete(key);
            } catch (CacheException e) {
                log.warn("Failed to invalidate key={} event={}: {}", key, event.type(), e.getMessage());
            }
        }

        final String pattern = event.pattern();
        if (pattern != null && !pattern.isBlank()) {
            try {
                backend.clear(pattern);
            } catch (CacheException e) {
                log.warn("Failed to invalidate pattern={} event={}: {}", pattern, event.type(), e.getMessage());
            }
        }

        log.debug("Cache invalidated event={} keys={} pattern={}", event.type(), event.keys(), pattern);

        if (event.broadcast() && !event.notificationKeys().isEmpty()) {
            broadcast(event);
        }
    }

    private void broadcast(InvalidationEvent event) {
        final InvalidationBroadcaster target = broadcaster;
        if (target == null) {
            log.debug("No invalidation broadcaster registered, skipping event={}", event.type());
            return;
        }

        try {
            target.broadcastInvalidation(new InvalidationBroadcaster.Payload(event.notificationKeys(), event.type(), clock.instant()));
        } catch (Exception e) {
            log.warn("Invalidation broadcast failed event={}: {}", event.type(), e.getMessage());
        }
    }
}
