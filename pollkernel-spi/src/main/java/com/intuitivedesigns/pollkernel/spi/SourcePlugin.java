/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.spi;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.SourceConnector;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Sources.
 *
 * <p>Register implementations in
 * {@code META-INF/services/com.intuitivedesigns.pollkernel.spi.SourcePlugin}.</p>
 */
public interface SourcePlugin extends PipelinePlugin<SourceConnector> {

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE;
    }

    /**
     * Static capability: whether this source supports downstream acknowledgement
     * of delivered records. Answerable without building a connector.
     */
    default boolean canAcknowledge() {
        return false;
    }

    /**
     * Build a connector. Must validate the configuration and throw
     * {@link com.intuitivedesigns.pollkernel.core.ConfigurationException} before
     * touching the network.
     */
    @Override
    SourceConnector create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
