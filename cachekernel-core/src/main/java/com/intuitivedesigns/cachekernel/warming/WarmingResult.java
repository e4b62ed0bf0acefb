/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.warming;

import java.time.Duration;

public record WarmingResult(String name, boolean success, Throwable error, Duration latency) {

    static WarmingResult succeeded(String name, Duration latency) {
        return new WarmingResult(name, true, null, latency);
    }

    static WarmingResult failed(String name, Throwable error, Duration latency) {
        return new WarmingResult(name, false, error, latency);
    }
}
