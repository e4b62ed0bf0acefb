/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

/**
 * Key namespacing and pattern matching shared by the backends.
 * <p>
 * Keys are stored as {@code <prefix>:<key>}. Patterns support an exact key or a single
 * trailing {@code *}; no other glob syntax is recognised.
 */
public final class KeySpace {

    public static final char WILDCARD = '*';

    private final String prefix;

    public KeySpace(String prefix) {
        this.prefix = (prefix == null || prefix.isBlank()) ? "" : prefix.trim() + ":";
    }

    public String prefix() {
        return prefix;
    }

    public String apply(String key) {
        return prefix.isEmpty() ? key : prefix + key;
    }

    /**
     * @return the key with the namespace removed, or the input unchanged if it carries no namespace
     */
    public String strip(String storedKey) {
        if (!prefix.isEmpty() && storedKey.startsWith(prefix)) {
            return storedKey.substring(prefix.length());
        }
        return storedKey;
    }

    public static boolean isPrefixPattern(String pattern) {
        return pattern != null && !pattern.isEmpty() && pattern.charAt(pattern.length() - 1) == WILDCARD;
    }

    /**
     * Match an already-namespaced key against an already-namespaced pattern.
     */
    public static boolean matches(String pattern, String key) {
        if (isPrefixPattern(pattern)) {
            return key.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(key);
    }
}
