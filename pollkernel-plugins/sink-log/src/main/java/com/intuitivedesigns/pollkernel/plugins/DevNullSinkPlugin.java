/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.plugins;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.OutputSink;
import com.intuitivedesigns.pollkernel.core.PipelinePayload;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.spi.SinkPlugin;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * {@code sink.type=DEVNULL}: counts records and drops them. Useful for a dry run
 * of the schedule and the query against a live database.
 */
public final class DevNullSinkPlugin implements SinkPlugin {

    public static final String ID = "DEVNULL";
    public static final String METRIC_DISCARDED = "sink.devnull.discarded";

    private static final Logger log = LoggerFactory.getLogger(DevNullSinkPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink<GenericValue> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(metrics, "metrics");
        log.warn("DEVNULL sink selected: emitted records are discarded");
        return new Discarding(metrics);
    }

    private static final class Discarding implements OutputSink<GenericValue> {

        private final MetricsRuntime metrics;
        private final LongAdder discarded = new LongAdder();

        private Discarding(MetricsRuntime metrics) {
            this.metrics = metrics;
        }

        @Override
        public void write(PipelinePayload<GenericValue> payload) {
            discarded.increment();
            metrics.increment(METRIC_DISCARDED);
        }

        @Override
        public String id() {
            return "devnull";
        }

        @Override
        public void close() {
            log.info("DEVNULL sink closed after discarding {} record(s)", discarded.sum());
        }
    }
}
