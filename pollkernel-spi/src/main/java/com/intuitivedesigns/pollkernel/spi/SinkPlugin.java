/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.spi;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.OutputSink;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.value.GenericValue;

/**
 * Builds the sink a pipeline hands its records to, selected by {@code sink.type}.
 */
public interface SinkPlugin extends PipelinePlugin<OutputSink<GenericValue>> {

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    OutputSink<GenericValue> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
