/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

/**
 * A structured value could not be encoded to, or decoded from, cache bytes.
 */
public class SerializationException extends CacheException {

    public SerializationException(String operation, String key, Throwable cause) {
        super(operation, key, cause);
    }
}
