/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.plugins;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import com.intuitivedesigns.pollkernel.core.OutputSink;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.output.GenericValueJson;
import com.intuitivedesigns.pollkernel.output.LogSink;
import com.intuitivedesigns.pollkernel.spi.SinkPlugin;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Locale;
import java.util.Objects;

/**
 * Logs each record as JSON. The default sink.
 * <p>
 * ID: LOG
 */
public final class LogSinkPlugin implements SinkPlugin {

    public static final String ID = "LOG";
    private static final Logger log = LoggerFactory.getLogger(LogSinkPlugin.class);

    // Config keys
    static final String CFG_LOG_LEVEL = "sink.log.level";
    static final String CFG_PRETTY = "sink.log.pretty";
    static final String CFG_MAX_CHARS = "sink.log.max.chars";

    // Defaults
    private static final String DEFAULT_LOG_LEVEL = "INFO";
    private static final int DEFAULT_MAX_CHARS = 0;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink<GenericValue> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final Level level = parseLevel(config.getString(CFG_LOG_LEVEL, DEFAULT_LOG_LEVEL));
        final boolean pretty = config.getBoolean(CFG_PRETTY, false);
        final int maxChars = config.getInt(CFG_MAX_CHARS, DEFAULT_MAX_CHARS);

        log.info("Initialized Log sink (Level={}, Pretty={}, MaxChars={})", level, pretty, maxChars);
        return new LogSink(new GenericValueJson(), level, pretty, maxChars, metrics);
    }

    static Level parseLevel(String raw) {
        try {
            return Level.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid " + CFG_LOG_LEVEL + ": '" + raw + "'", e);
        }
    }
}
