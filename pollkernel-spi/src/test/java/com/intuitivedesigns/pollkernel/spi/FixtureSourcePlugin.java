/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.spi;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.SourceConnector;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.value.GenericValue;

import java.util.List;

/**
 * Registered through {@code META-INF/services} on the test classpath only.
 */
public final class FixtureSourcePlugin implements SourcePlugin {

    @Override
    public String id() {
        return " fixture ";
    }

    @Override
    public SourceConnector create(PipelineConfig config, MetricsRuntime metrics) {
        return new SourceConnector() {
            @Override
            public void connect() {}

            @Override
            public void disconnect() {}

            @Override
            public List<GenericValue> poll() {
                return List.of();
            }
        };
    }
}
