/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Selects the configured {@link MetricsProvider}.
 *
 * <p>Metrics never stop a pipeline from starting: an unknown provider or one that
 * fails to start is logged and replaced by the no-op runtime.</p>
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private static final MetricsRuntime NOOP = () -> null;

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        if (settings.disabled()) {
            log.info("Metrics disabled ({}={})", MetricsSettings.KEY_PROVIDER, settings.providerId());
            return NOOP;
        }

        final MetricsProvider provider = find(settings.providerId());
        if (provider == null) {
            log.warn("No metrics provider '{}' on the classpath; metrics disabled", settings.providerId());
            return NOOP;
        }

        try {
            final MetricsRuntime rt = provider.create(settings);
            log.info("Metrics runtime initialized: {} ({})", provider.id(), provider.getClass().getName());
            return (rt != null) ? rt : NOOP;
        } catch (RuntimeException | LinkageError e) {
            // LinkageError: provider present but its backend jar missing
            log.warn("Metrics provider '{}' failed to start, metrics disabled: {}", provider.id(), e.toString());
            log.debug("Provider start failure", e);
            return NOOP;
        }
    }

    /**
     * The shared do-nothing runtime; its registry is {@code null}.
     */
    public static MetricsRuntime noop() {
        return NOOP;
    }

    private static MetricsProvider find(String id) {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        final ClassLoader cl = (ctx != null) ? ctx : MetricsFactory.class.getClassLoader();
        for (MetricsProvider p : ServiceLoader.load(MetricsProvider.class, cl)) {
            if (p.id().trim().toUpperCase(Locale.ROOT).equals(id)) {
                return p;
            }
        }
        return null;
    }
}
