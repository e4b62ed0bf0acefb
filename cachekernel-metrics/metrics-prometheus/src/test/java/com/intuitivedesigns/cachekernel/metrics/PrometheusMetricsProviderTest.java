/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

import com.intuitivedesigns.cachekernel.config.KernelConfig;
import io.micrometer.core.instrument.Tags;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMetricsProviderTest {

    @Test
    void testScrapeEndpointExposesCacheMeters() throws Exception {
        PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        PrometheusMetricsProvider.ServerHandle handle = PrometheusMetricsProvider.start(reg, 0);

        try (MicrometerMetricsRuntime rt = new MicrometerMetricsRuntime(reg, "PROMETHEUS", handle)) {
            rt.counter("cache.hits");

            HttpURLConnection conn = (HttpURLConnection) new URL("http://127.0.0.1:" + handle.port() + PrometheusMetricsProvider.PATH).openConnection();
            assertEquals(200, conn.getResponseCode());

            String body;
            try (InputStream in = conn.getInputStream()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            assertTrue(body.contains("cache_hits_total"), body);
            assertEquals("PROMETHEUS", rt.type());
        }
    }

    @Test
    void testCommonTagsCarryCacheBackend() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.fromMap(Map.of(
                "cache.type", "REDIS",
                "metrics.tag.region", " eu-west ",
                "metrics.tag.blank", "  ")));

        Tags tags = PrometheusMetricsProvider.commonTags(s);

        assertEquals(Tags.of("cache.backend", "redis", "region", "eu-west"), tags);
    }

    @Test
    void testExplicitBackendTagWins() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.fromMap(Map.of("metrics.tag.cache.backend", "edge")));

        Tags tags = PrometheusMetricsProvider.commonTags(s);

        assertEquals(Tags.of("cache.backend", "edge"), tags);
    }

    @Test
    void testScrapeShowsCommonTags() {
        PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        reg.config().commonTags(PrometheusMetricsProvider.commonTags(MetricsSettings.from(KernelConfig.empty())));

        reg.counter("cache.misses").increment();

        assertTrue(reg.scrape().contains("cache_backend=\"memory\""), reg.scrape());
        reg.close();
    }

    @Test
    void testIgnoresOtherProviders() {
        assertNull(new PrometheusMetricsProvider().create(null));
    }
}
