/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.metrics;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NoopMetricsProviderTest {

    @Test
    void init_shouldSelectNoopCaseInsensitively() {
        MetricsRuntime rt = MetricsFactory.init(MetricsSettings.from(new PipelineConfig(Map.of("metrics.provider", "noop"))));

        assertSame(MetricsFactory.noop(), rt);
        assertFalse(rt.enabled());
        assertNull(rt.registry());
    }

    @Test
    void noop_shouldAcceptEveryRecording() {
        MetricsRuntime rt = new NoopMetricsProvider().create(MetricsSettings.from(new PipelineConfig(Map.of())));
        MetricsRuntime tagged = rt.tagged("pipeline", "orders");

        assertDoesNotThrow(() -> {
            tagged.increment("poll.ticks");
            tagged.count("poll.rows", 3);
            tagged.record("poll.query.latency", Duration.ofMillis(5), "phase", "query");
            tagged.close();
        });
        assertEquals("NOOP", tagged.type());
    }
}
