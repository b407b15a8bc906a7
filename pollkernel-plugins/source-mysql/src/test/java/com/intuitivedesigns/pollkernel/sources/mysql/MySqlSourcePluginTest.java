/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import com.intuitivedesigns.pollkernel.core.ConnectionException;
import com.intuitivedesigns.pollkernel.core.SourceConnector;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.pollkernel.spi.PluginCatalog;
import com.intuitivedesigns.pollkernel.spi.SourcePlugin;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MySqlSourcePluginTest {

    private final MetricsRuntime metrics = MicrometerMetricsRuntime.inMemory();
    private final MySqlSourcePlugin plugin = new MySqlSourcePlugin();

    @Test
    void catalog_shouldDiscoverMySqlPlugin() {
        SourcePlugin found = new PluginCatalog(getClass().getClassLoader()).sources().require("mysql", "source.type");

        assertInstanceOf(MySqlSourcePlugin.class, found);
        assertFalse(found.canAcknowledge());
    }

    @Test
    void create_shouldRequireStatement() {
        assertThrows(ConfigurationException.class, () -> plugin.create(config(Map.of()), metrics));
        assertThrows(ConfigurationException.class,
                () -> plugin.create(config(Map.of(MySqlSourcePlugin.KEY_STATEMENT, "   ")), metrics));
    }

    @Test
    void create_shouldRejectInvalidSettings() {
        assertThrows(ConfigurationException.class, () -> plugin.create(config(Map.of(
                MySqlSourcePlugin.KEY_STATEMENT, "SELECT 1",
                MySqlConfig.KEY_PORT, "70000")), metrics));
        assertThrows(ConfigurationException.class, () -> plugin.create(config(Map.of(
                MySqlSourcePlugin.KEY_STATEMENT, "SELECT 1",
                MySqlSourcePlugin.KEY_TIME_ENCODING, "ISO")), metrics));
    }

    @Test
    void create_shouldNotTouchTheNetwork() {
        SourceConnector source = plugin.create(config(Map.of(
                MySqlSourcePlugin.KEY_STATEMENT, "SELECT 1",
                MySqlConfig.KEY_HOST, "db.invalid")), metrics);

        assertEquals("MYSQL", source.type());
        assertFalse(source.canAcknowledge());
        assertThrows(ConnectionException.class, source::poll);
    }

    @Test
    void poll_shouldFailWithConnectionExceptionWhenServerIsUnreachable() {
        SourceConnector source = plugin.create(config(Map.of(
                MySqlSourcePlugin.KEY_STATEMENT, "SELECT 1",
                MySqlConfig.KEY_HOST, "127.0.0.1",
                MySqlConfig.KEY_PORT, "1")), metrics);

        assertTimeoutPreemptively(Duration.ofSeconds(15), () -> {
            source.connect();
            try {
                assertThrows(ConnectionException.class, source::poll);
            } finally {
                source.disconnect();
            }
        });
    }

    @Test
    void mySqlConfig_shouldBuildUrlAndMaskPassword() {
        MySqlConfig cfg = MySqlConfig.from(config(Map.of(
                MySqlConfig.KEY_DATABASE, "ops",
                MySqlConfig.KEY_USER, "monitor",
                MySqlConfig.KEY_PASSWORD, "s3cret")));

        assertEquals("localhost", cfg.host());
        assertEquals(3306, cfg.port());
        assertEquals("jdbc:mysql://localhost:3306/ops?useServerPrepStmts=true&cachePrepStmts=false", cfg.jdbcUrl());
        assertFalse(cfg.toString().contains("s3cret"));
    }

    private static PipelineConfig config(Map<String, String> values) {
        return new PipelineConfig(new HashMap<>(values));
    }
}
