/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.spi;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outbound hook for telling connected clients that cached data changed.
 * <p>
 * The host application registers the concrete transport (e.g. a push channel) after startup.
 * The cache never depends on that transport directly.
 */
@FunctionalInterface
public interface InvalidationBroadcaster {

    void broadcastInvalidation(Payload payload) throws Exception;

    /**
     * What subscribers receive: the keys they should refetch, the event label and when it happened.
     */
    record Payload(List<String> notificationKeys, String event, Instant timestamp) {
        public Payload {
            notificationKeys = List.copyOf(Objects.requireNonNull(notificationKeys, "notificationKeys"));
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
