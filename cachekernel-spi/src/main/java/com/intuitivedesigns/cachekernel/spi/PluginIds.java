/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.cachekernel.spi;

import java.util.Locale;

public final class PluginIds {
    private PluginIds() {}

    public static String normalize(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
    }
}
