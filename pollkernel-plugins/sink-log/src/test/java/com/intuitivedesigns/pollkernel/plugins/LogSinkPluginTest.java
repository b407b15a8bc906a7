/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.plugins;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import com.intuitivedesigns.pollkernel.core.EventRecords;
import com.intuitivedesigns.pollkernel.core.OutputSink;
import com.intuitivedesigns.pollkernel.core.PipelinePayload;
import com.intuitivedesigns.pollkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.pollkernel.output.LogSink;
import com.intuitivedesigns.pollkernel.spi.PluginCatalog;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogSinkPluginTest {

    private final MicrometerMetricsRuntime metrics = MicrometerMetricsRuntime.inMemory();

    @Test
    void catalog_shouldDiscoverLogAndDevNull() {
        PluginCatalog catalog = new PluginCatalog(getClass().getClassLoader());

        assertInstanceOf(LogSinkPlugin.class, catalog.sinks().require("log", "sink.type"));
        assertInstanceOf(DevNullSinkPlugin.class, catalog.sinks().require("devnull", "sink.type"));
    }

    @Test
    void logSink_shouldAcceptBatchesAndCountRecords() throws Exception {
        OutputSink<GenericValue> sink = new LogSinkPlugin().create(new PipelineConfig(Map.of("sink.log.pretty", "true")), metrics);

        sink.writeBatch(List.of(record(), record()));
        sink.close();

        assertEquals(2, ((LogSink) sink).written());
        assertEquals(2.0, metrics.registry().get("sink.log.records").counter().count());
    }

    @Test
    void parseLevel_shouldRejectUnknownLevels() {
        assertEquals(Level.DEBUG, LogSinkPlugin.parseLevel(" debug "));
        assertThrows(ConfigurationException.class, () -> LogSinkPlugin.parseLevel("LOUD"));
    }

    @Test
    void devNull_shouldCountDiscardedRecords() throws Exception {
        OutputSink<GenericValue> sink = new DevNullSinkPlugin().create(new PipelineConfig(Map.of()), metrics);

        sink.writeBatch(List.of(record(), record(), record()));
        sink.close();

        assertEquals("devnull", sink.id());
        assertEquals(3.0, metrics.registry().get(DevNullSinkPlugin.METRIC_DISCARDED).counter().count());
    }

    private static PipelinePayload<GenericValue> record() {
        return EventRecords.of(Instant.EPOCH, List.of(GenericValue.object(Map.of("n", GenericValue.integer(1)))), "MYSQL", "p");
    }
}
