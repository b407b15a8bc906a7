/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.intuitivedesigns.pollkernel.core.OutputSink;
import com.intuitivedesigns.pollkernel.core.PipelinePayload;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Writes every record as one JSON document through SLF4J.
 */
public final class LogSink implements OutputSink<GenericValue> {

    private static final Logger log = LoggerFactory.getLogger(LogSink.class);

    static final String METRIC_WRITTEN = "sink.log.records";

    private final GenericValueJson json;
    private final Level level;
    private final boolean pretty;
    private final int maxChars;
    private final MetricsRuntime metrics;
    private final LongAdder written = new LongAdder();

    /**
     * @param maxChars truncate documents longer than this; {@code 0} disables truncation
     */
    public LogSink(GenericValueJson json, Level level, boolean pretty, int maxChars, MetricsRuntime metrics) {
        this.json = Objects.requireNonNull(json, "json");
        this.level = Objects.requireNonNull(level, "level");
        this.pretty = pretty;
        this.maxChars = Math.max(0, maxChars);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void write(PipelinePayload<GenericValue> payload) throws JsonProcessingException {
        if (payload == null) return;

        written.increment();
        metrics.increment(METRIC_WRITTEN);

        if (!log.isEnabledForLevel(level)) return;
        log.atLevel(level).log("{}", truncate(json.write(json.toNode(payload), pretty)));
    }

    public long written() {
        return written.sum();
    }

    private String truncate(String s) {
        if (maxChars == 0 || s.length() <= maxChars) return s;
        return s.substring(0, maxChars) + "... [TRUNCATED]";
    }

    @Override
    public void close() {
        log.info("Log sink closed. records={}", written.sum());
    }
}
