/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.invalidation;

import java.util.List;
import java.util.Objects;

/**
 * An administrative change that makes cached data stale.
 *
 * @param type             label forwarded to subscribers (e.g. "feature_flags")
 * @param keys             exact keys to delete
 * @param pattern          exact key or trailing-wildcard pattern to clear; may be null
 * @param broadcast        forward a notice to connected clients; global changes only, never user-scoped ones
 * @param notificationKeys what subscribers should refetch
 */
public record InvalidationEvent(String type, List<String> keys, String pattern,
                                boolean broadcast, List<String> notificationKeys) {

    public InvalidationEvent {
        Objects.requireNonNull(type, "type");
        keys = (keys == null) ? List.of() : List.copyOf(keys);
        notificationKeys = (notificationKeys == null) ? List.of() : List.copyOf(notificationKeys);
    }

    public static InvalidationEvent ofKeys(String type, String... keys) {
        return new InvalidationEvent(type, List.of(keys), null, false, List.of());
    }

    public static InvalidationEvent ofPattern(String type, String pattern) {
        return new InvalidationEvent(type, List.of(), pattern, false, List.of());
    }

    public InvalidationEvent withBroadcast(String... notificationKeys) {
        return new InvalidationEvent(type, keys, pattern, true, List.of(notificationKeys));
    }
}
