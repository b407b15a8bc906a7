/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link MetricsRuntime} over a Micrometer {@link MeterRegistry}.
 *
 * <p>Counters ignore non-positive amounts; Micrometer counters only move forward.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final MeterRegistry registry;
    private final String type;
    private final Runnable onClose;

    /**
     * @param onClose extra teardown run before the registry closes (e.g. stopping a scrape endpoint); may be null
     */
    public MicrometerMetricsRuntime(MeterRegistry registry, String type, Runnable onClose) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.type = (type == null || type.isBlank()) ? "MICROMETER" : type;
        this.onClose = onClose;
    }

    /**
     * Backed by a {@link SimpleMeterRegistry}; used by tests that assert on recorded values.
     */
    public static MicrometerMetricsRuntime inMemory() {
        return new MicrometerMetricsRuntime(new SimpleMeterRegistry(), "MICROMETER", null);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void count(String name, double amount, String... tags) {
        if (amount > 0) {
            registry.counter(name, Tags.of(tags)).increment(amount);
        }
    }

    @Override
    public void record(String name, Duration duration, String... tags) {
        if (duration != null && !duration.isNegative()) {
            registry.timer(name, Tags.of(tags)).record(duration);
        }
    }

    @Override
    public void close() {
        if (onClose != null) {
            try {
                onClose.run();
            } catch (RuntimeException e) {
                log.warn("Metrics close hook failed: {}", e.getMessage());
            }
        }
        registry.close();
        log.info("Metrics Runtime Closed ({}).", type);
    }
}
