/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Process-wide metrics configuration.
 *
 * <pre>
 * metrics.provider=PROMETHEUS        # NONE (default), NOOP, PROMETHEUS
 * metrics.prometheus.port=9090
 * metrics.prometheus.path=/metrics
 * metrics.tag.env=prod               # common tag on every meter
 * </pre>
 *
 * @param providerId     upper-case provider id
 * @param commonTags     tags applied to every meter, sorted by key
 * @param prometheusPort scrape port
 * @param prometheusPath scrape path, always starting with {@code /}
 */
public record MetricsSettings(String providerId,
                              Map<String, String> commonTags,
                              int prometheusPort,
                              String prometheusPath) {

    public static final String KEY_PROVIDER = "metrics.provider";
    public static final String KEY_TAG_PREFIX = "metrics.tag.";
    public static final String KEY_PROM_PORT = "metrics.prometheus.port";
    public static final String KEY_PROM_PATH = "metrics.prometheus.path";

    public static final String PROVIDER_NONE = "NONE";

    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_PROM_PATH = "/metrics";

    public MetricsSettings {
        providerId = (providerId == null || providerId.isBlank())
                ? PROVIDER_NONE
                : providerId.trim().toUpperCase(Locale.ROOT);
        commonTags = (commonTags == null) ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(commonTags));
        if (prometheusPort < 1 || prometheusPort > 65_535) {
            throw new ConfigurationException("Invalid value for '" + KEY_PROM_PORT + "': " + prometheusPort);
        }
        prometheusPath = (prometheusPath == null || prometheusPath.isBlank())
                ? DEFAULT_PROM_PATH
                : (prometheusPath.startsWith("/") ? prometheusPath.trim() : "/" + prometheusPath.trim());
    }

    public static MetricsSettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final Map<String, String> tags = new TreeMap<>();
        for (Map.Entry<String, Object> e : config.asMap().entrySet()) {
            final String key = e.getKey();
            if (key == null || !key.startsWith(KEY_TAG_PREFIX) || e.getValue() == null) continue;

            final String name = key.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = String.valueOf(e.getValue()).trim();
            // Micrometer rejects blank tag keys and values
            if (!name.isEmpty() && !value.isEmpty()) {
                tags.put(name, value);
            }
        }

        return new MetricsSettings(
                config.getString(KEY_PROVIDER, PROVIDER_NONE),
                tags,
                config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT),
                config.getOptionalString(KEY_PROM_PATH));
    }

    public boolean disabled() {
        return PROVIDER_NONE.equals(providerId);
    }

    /**
     * {@link #commonTags()} as Micrometer tags.
     */
    public Tags tags() {
        final List<Tag> out = new ArrayList<>(commonTags.size());
        commonTags.forEach((k, v) -> out.add(Tag.of(k, v)));
        return Tags.of(out);
    }
}
