/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.aside;

/**
 * Loads a value from the source of truth after a cache miss.
 */
@FunctionalInterface
public interface CacheLoader<T> {
    T load() throws Exception;
}
