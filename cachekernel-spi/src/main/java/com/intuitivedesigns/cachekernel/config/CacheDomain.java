/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.config;

/**
 * Names of the per-domain TTL buckets understood by {@link CacheSettings#ttlFor(String)}.
 */
public final class CacheDomain {

    public static final String DEFAULT = "default";
    public static final String HEALTH_CHECK = "health_check";
    public static final String USER_PROFILE = "user_profile";
    public static final String SESSION = "session";
    public static final String ORGANIZATION = "organization";
    public static final String MEMBERSHIP = "membership";

    private CacheDomain() {}
}
