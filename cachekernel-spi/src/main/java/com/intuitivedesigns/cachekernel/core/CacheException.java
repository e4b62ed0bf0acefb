/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

/**
 * A cache operation failed. A miss is never reported through this type.
 */
public class CacheException extends Exception {

    private final String operation;
    private final String key;

    public CacheException(String operation, String key, String message) {
        super(format(operation, key, message));
        this.operation = operation;
        this.key = key;
    }

    public CacheException(String operation, String key, Throwable cause) {
        super(format(operation, key, cause == null ? null : cause.getMessage()), cause);
        this.operation = operation;
        this.key = key;
    }

    public String operation() {
        return operation;
    }

    /**
     * @return the key (or pattern) involved, or null for key-less operations such as ping
     */
    public String key() {
        return key;
    }

    private static String format(String op, String key, String detail) {
        StringBuilder sb = new StringBuilder("cache ").append(op);
        if (key != null && !key.isEmpty()) {
            sb.append(' ').append(key);
        }
        if (detail != null) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
