/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.config;

import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void getters_shouldApplyDefaultsWhenMissingOrBlank() {
        PipelineConfig config = new PipelineConfig(Map.of("blank", "  "));

        assertEquals(3306, config.getInt("missing", 3306));
        assertEquals(3306, config.getInt("blank", 3306));
        assertEquals(250L, config.getLong("missing", 250L));
        assertTrue(config.getBoolean("missing", true));
        assertNull(config.getOptionalString("blank"));
        assertEquals("fallback", config.getString("missing", "fallback"));
    }

    @Test
    void getInt_shouldRejectGarbage() {
        PipelineConfig config = new PipelineConfig(Map.of("source.mysql.port", "abc"));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> config.getInt("source.mysql.port", 3306));
        assertTrue(e.getMessage().contains("source.mysql.port"));
    }

    @Test
    void requireString_shouldRejectBlank() {
        PipelineConfig config = new PipelineConfig(Map.of("source.statement", "   "));
        assertThrows(ConfigurationException.class, () -> config.requireString("source.statement"));
    }

    @Test
    void getOptionalString_shouldTrim() {
        PipelineConfig config = new PipelineConfig(Map.of("source.type", " MYSQL "));
        assertEquals("MYSQL", config.getOptionalString("source.type"));
    }

    @Test
    void getList_shouldSplitAndDropBlanks() {
        PipelineConfig config = new PipelineConfig(Map.of("pipelines", "a, b,,c "));
        assertEquals(List.of("a", "b", "c"), config.getList("pipelines"));
        assertTrue(config.getList("missing").isEmpty());
    }

    @Test
    void scoped_shouldStripPrefix() {
        PipelineConfig config = new PipelineConfig(Map.of(
                "pipelines.orders.source.type", "MYSQL",
                "pipelines.orders.source.statement", "SELECT 1",
                "pipelines.users.source.type", "OTHER",
                "metrics.provider", "NONE"));

        PipelineConfig orders = config.scoped("pipelines.orders.");

        assertEquals("MYSQL", orders.getOptionalString("source.type"));
        assertEquals("SELECT 1", orders.getOptionalString("source.statement"));
        assertEquals(2, orders.keys().size());
        assertFalse(orders.hasPath("metrics.provider"));
    }
}
