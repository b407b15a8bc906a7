/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Micrometer Prometheus registry scraped over the JDK HTTP server on
 * {@code metrics.prometheus.port} and {@code metrics.prometheus.path}.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        final PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        registry.config().commonTags(settings.tags());

        final ServerHandle handle;
        try {
            handle = start(registry, settings.prometheusPort(), settings.prometheusPath());
        } catch (RuntimeException e) {
            registry.close();
            throw e;
        }

        log.info("Prometheus scrape endpoint on :{}{}", settings.prometheusPort(), settings.prometheusPath());
        return new MicrometerMetricsRuntime(registry, id(), handle::close);
    }

    private static ServerHandle start(PrometheusMeterRegistry registry, int port, String path) {
        Objects.requireNonNull(registry, "registry");

        final HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot bind Prometheus endpoint to port " + port, e);
        }

        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pk-metrics-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext(path, exchange -> {
            try {
                final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } catch (IOException e) {
                log.debug("Scrape response failed: {}", e.getMessage());
            } finally {
                exchange.close();
            }
        });

        server.start();
        return new ServerHandle(server, executor);
    }

    private static final class ServerHandle {
        private final HttpServer server;
        private final ExecutorService executor;

        private ServerHandle(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
