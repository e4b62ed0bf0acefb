/*
 * Copyright 2025 Steven Lopez
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekernel.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Exposes the cache meters (hits, misses, errors, latencies) on {@code /metrics} for scraping.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    static final String PATH = "/metrics";
    static final String BACKEND_TAG = "cache.backend";

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        reg.config().commonTags(commonTags(s));

        final ServerHandle handle = start(reg, s.prometheusPort);
        log.info("Prometheus Metrics Active (port={}, path={})", handle.port(), PATH);

        return new MicrometerMetricsRuntime(reg, "PROMETHEUS", handle);
    }

    /**
     * {@code metrics.tag.*} entries plus {@code cache.backend}. Blank keys and values are dropped;
     * an explicit {@code metrics.tag.cache.backend} wins over the configured cache type.
     */
    static Tags commonTags(MetricsSettings s) {
        final List<Tag> out = new ArrayList<>(s.commonTags.size() + 1);
        boolean backendTagged = false;
        for (Map.Entry<String, String> e : s.commonTags.entrySet()) {
            final String k = e.getKey() == null ? "" : e.getKey().trim();
            final String v = e.getValue() == null ? "" : e.getValue().trim();
            // Micrometer rejects null keys and values
            if (k.isEmpty() || v.isEmpty()) continue;
            out.add(Tag.of(k, v));
            backendTagged |= BACKEND_TAG.equals(k);
        }
        if (!backendTagged) {
            out.add(Tag.of(BACKEND_TAG, s.cacheBackend));
        }
        return Tags.of(out);
    }

    static ServerHandle start(PrometheusMeterRegistry registry, int port) {
        Objects.requireNonNull(registry, "registry");

        final HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start Prometheus metrics server on port " + port, e);
        }

        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metrics-http-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext(PATH, exchange -> {
            try {
                final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } catch (IOException e) {
                log.debug("Scrape request failed", e);
            } finally {
                exchange.close();
            }
        });

        server.start();
        return new ServerHandle(server, executor);
    }

    static final class ServerHandle implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ServerHandle(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        int port() {
            return server.getAddress().getPort();
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
