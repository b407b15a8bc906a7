/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.config;

import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import com.intuitivedesigns.pollkernel.core.FailurePolicy;
import com.intuitivedesigns.pollkernel.core.OutputSink;
import com.intuitivedesigns.pollkernel.core.PollOrchestrator;
import com.intuitivedesigns.pollkernel.core.ShutdownSignal;
import com.intuitivedesigns.pollkernel.core.SourceConnector;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.schedule.CronSchedule;
import com.intuitivedesigns.pollkernel.spi.PipelinePlugin;
import com.intuitivedesigns.pollkernel.spi.PluginCatalog;
import com.intuitivedesigns.pollkernel.spi.SinkPlugin;
import com.intuitivedesigns.pollkernel.spi.SourcePlugin;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wires one pipeline from configuration: schedule, source and sink plugins, failure policy.
 *
 * <p>Everything that can be validated offline is validated here, so a bad cron
 * expression or a missing statement fails before any connection is attempted.</p>
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    public static final String KEY_SOURCE_TYPE = "source.type";
    public static final String KEY_SINK_TYPE = "sink.type";
    public static final String KEY_SCHEDULE = "source.schedule";
    public static final String KEY_SCHEDULE_TIMEZONE = "source.schedule.timezone";

    // Defaults
    private static final String DEFAULT_SINK = "LOG";

    private static final PluginCatalog CATALOG = PluginCatalog.load();

    private PipelineFactory() {}

    // --- FACTORY METHODS ---

    /**
     * Build a ready-to-start pipeline. Nothing touches the network until it is started.
     */
    public static PollOrchestrator createPipeline(String name,
                                                  PipelineConfig config,
                                                  MetricsRuntime metrics,
                                                  ShutdownSignal shutdown) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(shutdown, "shutdown");

        // 1. Offline validation first
        final CronSchedule schedule = createSchedule(config);
        final FailurePolicy failurePolicy = FailurePolicy.from(config);

        // 2. Components (SPI), with their metrics scoped to this pipeline
        final MetricsRuntime scoped = metrics.tagged("pipeline", (name != null && !name.isBlank()) ? name.trim() : "default");
        final SourceConnector source = createSource(config, scoped);
        final OutputSink<GenericValue> sink;
        try {
            sink = createSink(config, scoped);
        } catch (RuntimeException e) {
            source.disconnect();
            throw e;
        }

        log.info("Pipeline '{}' assembled: source={} sink={} schedule={} failFast={}",
                name, source.type(), sink.id(), (schedule != null ? schedule : "<run once>"), failurePolicy.failFast());

        return new PollOrchestrator(name, source, sink, schedule, shutdown, metrics, failurePolicy);
    }

    /**
     * @return the parsed schedule, or {@code null} when none is configured (run once)
     */
    public static CronSchedule createSchedule(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String expression = config.getOptionalString(KEY_SCHEDULE);
        if (expression == null) {
            return null;
        }
        return CronSchedule.parse(expression, config.getOptionalString(KEY_SCHEDULE_TIMEZONE));
    }

    public static SourceConnector createSource(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final SourcePlugin plugin = sourcePlugin(config);
        return createSafe(plugin, config, metrics, "Source");
    }

    public static OutputSink<GenericValue> createSink(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_SINK_TYPE, DEFAULT_SINK), DEFAULT_SINK);
        final SinkPlugin plugin = CATALOG.sinks().require(id, KEY_SINK_TYPE);
        return createSafe(plugin, config, metrics, "Sink");
    }

    /**
     * Static capability query: can the configured source acknowledge delivered records?
     */
    public static boolean sourceCanAcknowledge(PipelineConfig config) {
        return sourcePlugin(config).canAcknowledge();
    }

    // --- UTILITIES ---

    public static void logAvailablePlugins() {
        log.info("Plugin catalog loaded: {}", CATALOG.summary());
    }

    private static SourcePlugin sourcePlugin(PipelineConfig config) {
        final String id = config.requireString(KEY_SOURCE_TYPE);
        return CATALOG.sources().require(id, KEY_SOURCE_TYPE);
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static <T> T createSafe(PipelinePlugin<T> plugin,
                                    PipelineConfig config,
                                    MetricsRuntime metrics,
                                    String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
