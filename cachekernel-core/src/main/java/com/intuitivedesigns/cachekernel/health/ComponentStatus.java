/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.health;

import java.time.Duration;

/**
 * @param latency ping round trip; null unless the backend answered
 */
public record ComponentStatus(String name, String status, String message, Duration latency) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
