/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.spi;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;

/**
 * Common shape of every ServiceLoader-discovered plugin.
 *
 * @param <T> the component the plugin builds
 */
public interface PipelinePlugin<T> {

    /**
     * @return The unique ID of this plugin implementation (e.g., 'MYSQL', 'LOG').
     */
    String id();

    PluginKind kind();

    T create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
