/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.spi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServicePluginRegistryTest {

    private static ServicePlugin plugin(String id) {
        return () -> id;
    }

    @Test
    void testLookupIsCaseInsensitive() {
        ServicePlugin a = plugin("alpha");
        ServicePluginRegistry<ServicePlugin> registry = new ServicePluginRegistry<>(ServicePlugin.class, List.of(a, plugin("Beta")));

        assertSame(a, registry.require(" ALPHA ", "cache.type"));
        assertTrue(registry.get("beta").isPresent());
        assertTrue(registry.get("gamma").isEmpty());
        assertEquals(List.of("ALPHA", "BETA"), List.copyOf(registry.availableIds()));
    }

    @Test
    void testUnknownIdNamesTheConfigKey() {
        ServicePluginRegistry<ServicePlugin> registry = new ServicePluginRegistry<>(ServicePlugin.class, List.of(plugin("alpha")));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> registry.require("zeta", "cache.type"));
        assertTrue(ex.getMessage().contains("cache.type=zeta"), ex.getMessage());
        assertTrue(ex.getMessage().contains("ALPHA"), ex.getMessage());
    }

    @Test
    void testDuplicateIdsAreRejected() {
        assertThrows(IllegalStateException.class,
                () -> new ServicePluginRegistry<>(ServicePlugin.class, List.of(plugin("a"), plugin("A"))));
    }

    @Test
    void testBlankIdIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> new ServicePluginRegistry<>(ServicePlugin.class, List.of(plugin(" "))));
    }
}
