/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

import java.time.Duration;
import java.util.Arrays;

final class TaggedMetricsRuntime implements MetricsRuntime {

    private final MetricsRuntime delegate;
    private final String[] tags;

    TaggedMetricsRuntime(MetricsRuntime delegate, String[] tags) {
        this.delegate = delegate;
        this.tags = tags.clone();
    }

    @Override
    public Object registry() {
        return delegate.registry();
    }

    @Override
    public boolean enabled() {
        return delegate.enabled();
    }

    @Override
    public String type() {
        return delegate.type();
    }

    @Override
    public void count(String name, double amount, String... extra) {
        delegate.count(name, amount, merge(extra));
    }

    @Override
    public void record(String name, Duration duration, String... extra) {
        delegate.record(name, duration, merge(extra));
    }

    @Override
    public MetricsRuntime tagged(String... extra) {
        if (extra == null || extra.length == 0) return this;
        return delegate.tagged(merge(extra));
    }

    @Override
    public void close() {
        // the delegate belongs to whoever created it
    }

    private String[] merge(String[] extra) {
        if (extra == null || extra.length == 0) return tags;
        final String[] out = Arrays.copyOf(tags, tags.length + extra.length);
        System.arraycopy(extra, 0, out, tags.length, extra.length);
        return out;
    }
}
