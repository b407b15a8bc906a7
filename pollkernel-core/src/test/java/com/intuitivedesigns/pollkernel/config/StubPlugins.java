/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.config;

import com.intuitivedesigns.pollkernel.core.OutputSink;
import com.intuitivedesigns.pollkernel.core.PipelinePayload;
import com.intuitivedesigns.pollkernel.core.SourceConnector;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.spi.SinkPlugin;
import com.intuitivedesigns.pollkernel.spi.SourcePlugin;
import com.intuitivedesigns.pollkernel.value.GenericValue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory plugins registered on the test classpath as {@code STUB} and {@code MEMORY}.
 */
public final class StubPlugins {

    static final AtomicInteger SOURCES_CREATED = new AtomicInteger();
    static final List<PipelinePayload<GenericValue>> WRITTEN = new CopyOnWriteArrayList<>();

    private StubPlugins() {}

    public static final class StubSourcePlugin implements SourcePlugin {
        @Override
        public String id() {
            return "STUB";
        }

        @Override
        public SourceConnector create(PipelineConfig config, MetricsRuntime metrics) {
            config.requireString("source.statement");
            SOURCES_CREATED.incrementAndGet();
            return new SourceConnector() {
                @Override
                public void connect() {}

                @Override
                public void disconnect() {}

                @Override
                public List<GenericValue> poll() {
                    return List.of(GenericValue.integer(1));
                }

                @Override
                public String type() {
                    return "STUB";
                }
            };
        }
    }

    public static final class MemorySinkPlugin implements SinkPlugin {
        @Override
        public String id() {
            return "MEMORY";
        }

        @Override
        public OutputSink<GenericValue> create(PipelineConfig config, MetricsRuntime metrics) {
            return new OutputSink<>() {
                @Override
                public void write(PipelinePayload<GenericValue> payload) {
                    WRITTEN.add(payload);
                }
            };
        }
    }
}
