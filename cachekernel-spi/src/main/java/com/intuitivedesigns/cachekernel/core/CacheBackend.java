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

import java.time.Duration;
import java.util.Optional;

/**
 * The operation set every cache backend implements.
 *
 * Examples:
 * - In-memory map with a TTL sweep
 * - Redis (or any network key/value service)
 * - No-op backend when caching is disabled
 *
 * The contract is deliberately byte-oriented; typed values are layered on top by the core module.
 *
 * <p><b>Thread-safety Contract:</b></p>
 * Every method may be called concurrently by an unlimited number of callers.
 */
public interface CacheBackend extends AutoCloseable {

    /**
     * Retrieve a value.
     * <p>
     * Expiration is checked at read time, so a value past its TTL is never returned,
     * even if a background sweep has not removed it yet.
     *
     * @param key cache key
     * @return a private copy of the value, or {@code Optional.empty()} on a miss
     * @throws CacheException if the backend fails (distinct from a miss)
     */
    Optional<byte[]> get(String key) throws CacheException;

    /**
     * Store a value. The backend keeps its own copy of {@code value}.
     *
     * @param ttl time-to-live; {@code null}, zero or negative means the entry never expires
     * @throws CacheException if the write fails
     */
    void set(String key, byte[] value, Duration ttl) throws CacheException;

    /**
     * Remove a key. Removing an absent key is not an error.
     */
    void delete(String key) throws CacheException;

    /**
     * @return true if the key is present and not expired
     */
    boolean exists(String key) throws CacheException;

    /**
     * Remove all keys matching {@code pattern}.
     * <p>
     * Supported forms: an exact key ({@code "user:1"}) or a single trailing wildcard
     * ({@code "user:*"}). Anything else is treated literally.
     */
    void clear(String pattern) throws CacheException;

    /**
     * Check connectivity. Remote backends also update {@link #isAvailable()} from the outcome.
     *
     * @throws BackendUnavailableException if the backend cannot be reached
     */
    void ping() throws CacheException;

    /**
     * @return false when the backend is known to be unusable (or is a no-op)
     */
    boolean isAvailable();

    /**
     * @return short identifier for logs and health output (e.g. "memory", "redis")
     */
    String name();

    /**
     * Release resources (background tasks, connection pools). Idempotent.
     */
    @Override
    void close();
}
