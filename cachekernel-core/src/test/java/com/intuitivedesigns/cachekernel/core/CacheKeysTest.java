/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    @Test
    void testKeyLayout() {
        assertEquals("user:42", CacheKeys.user(42));
        assertEquals("session:abc", CacheKeys.session("abc"));
        assertEquals("blacklist:deadbeef", CacheKeys.blacklist("deadbeef"));
        assertEquals("org:slug:acme", CacheKeys.orgBySlug("acme"));
        assertEquals("org:id:7", CacheKeys.orgById(7));
        assertEquals("membership:7:42", CacheKeys.membership(7, 42));
        assertEquals("feature_flags:all", CacheKeys.FEATURE_FLAGS_ALL);
    }

    @Test
    void testPatternsMatchTheirKeys() {
        assertTrue(KeySpace.matches(CacheKeys.orgMemberships(7), CacheKeys.membership(7, 42)));
        assertFalse(KeySpace.matches(CacheKeys.orgMemberships(7), CacheKeys.membership(70, 42)));
        assertTrue(KeySpace.matches(CacheKeys.allUsers(), CacheKeys.user(1)));
    }
}
