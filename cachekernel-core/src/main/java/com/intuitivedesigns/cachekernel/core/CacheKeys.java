/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.core;

/**
 * Key layout shared by every caller, so writers and invalidators agree on names.
 */
public final class CacheKeys {

    public static final String FEATURE_FLAGS_ALL = "feature_flags:all";

    static final String BLACKLIST_PREFIX = "blacklist:";
    static final String USER_PREFIX = "user:";
    static final String SESSION_PREFIX = "session:";
    static final String ORG_BY_SLUG_PREFIX = "org:slug:";
    static final String ORG_BY_ID_PREFIX = "org:id:";
    static final String MEMBERSHIP_PREFIX = "membership:";

    private CacheKeys() {}

    /**
     * Token blacklist lookup, keyed by a prefix of the token hash.
     */
    public static String blacklist(String tokenHashPrefix) {
        return BLACKLIST_PREFIX + tokenHashPrefix;
    }

    public static String user(long userId) {
        return USER_PREFIX + userId;
    }

    public static String allUsers() {
        return USER_PREFIX + KeySpace.WILDCARD;
    }

    public static String session(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }

    public static String orgBySlug(String slug) {
        return ORG_BY_SLUG_PREFIX + slug;
    }

    public static String orgById(long orgId) {
        return ORG_BY_ID_PREFIX + orgId;
    }

    public static String membership(long orgId, long userId) {
        return MEMBERSHIP_PREFIX + orgId + ":" + userId;
    }

    /**
     * Pattern covering every membership of one organization.
     */
    public static String orgMemberships(long orgId) {
        return MEMBERSHIP_PREFIX + orgId + ":" + KeySpace.WILDCARD;
    }
}
