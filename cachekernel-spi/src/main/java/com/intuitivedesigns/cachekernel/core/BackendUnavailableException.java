/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

/**
 * The backend could not be reached (connection refused, ping failure, pool exhausted).
 */
public class BackendUnavailableException extends CacheException {

    public BackendUnavailableException(String operation, String key, Throwable cause) {
        super(operation, key, cause);
    }

    public BackendUnavailableException(String operation, String key, String message) {
        super(operation, key, message);
    }
}
