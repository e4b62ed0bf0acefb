/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.warming;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one warming run. Results are in task registration order.
 */
public record WarmingReport(List<WarmingResult> results, Duration elapsed) {

    public WarmingReport {
        results = List.copyOf(results);
    }

    static WarmingReport skipped() {
        return new WarmingReport(List.of(), Duration.ZERO);
    }

    public long successCount() {
        return results.stream().filter(WarmingResult::success).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }
}
