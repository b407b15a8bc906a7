/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

/**
 * A metrics backend, discovered through {@link java.util.ServiceLoader} and chosen
 * by {@code metrics.provider}.
 *
 * <p>Register implementations in
 * {@code META-INF/services/com.intuitivedesigns.pollkernel.metrics.MetricsProvider}.</p>
 */
public interface MetricsProvider {

    /**
     * Upper-case id matched against {@code metrics.provider}, e.g. {@code PROMETHEUS}.
     */
    String id();

    /**
     * Only called for the selected provider. May start servers or threads;
     * those stop when the returned runtime is closed.
     */
    MetricsRuntime create(MetricsSettings settings);
}
