/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

import java.time.Duration;

/**
 * Instrumentation handle given to the poll loop and to every plugin.
 *
 * <p>Tags are passed as alternating key/value pairs. Every recording method is a
 * no-op by default, so a pipeline behaves identically with metrics disabled.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * The backing Micrometer {@code MeterRegistry}, or {@code null} when metrics are off.
     */
    Object registry();

    default boolean enabled() {
        return false;
    }

    /**
     * Provider id, e.g. {@code PROMETHEUS} or {@code NOOP}.
     */
    default String type() {
        return "NOOP";
    }

    default void increment(String name, String... tags) {
        count(name, 1.0, tags);
    }

    default void count(String name, double amount, String... tags) {}

    default void record(String name, Duration duration, String... tags) {}

    /**
     * A view that appends {@code tags} to everything recorded through it.
     * Closing the view does not close this runtime.
     */
    default MetricsRuntime tagged(String... tags) {
        if (tags == null || tags.length == 0) return this;
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs, got " + tags.length + " strings");
        }
        return new TaggedMetricsRuntime(this, tags);
    }

    @Override
    default void close() {}
}
