/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.config;

/**
 * Raised at startup when a setting cannot be used as given (e.g. a malformed connection target).
 */
public class ConfigurationException extends IllegalArgumentException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super("Invalid configuration '" + key + "': " + message);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super("Invalid configuration '" + key + "': " + message, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
