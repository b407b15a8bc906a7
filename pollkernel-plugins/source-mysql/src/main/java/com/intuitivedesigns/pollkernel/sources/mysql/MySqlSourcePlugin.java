/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.SourceConnector;
import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.spi.SourcePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * ID: MYSQL
 */
public final class MySqlSourcePlugin implements SourcePlugin {

    public static final String ID = "MYSQL";
    private static final Logger log = LoggerFactory.getLogger(MySqlSourcePlugin.class);

    // Config Keys
    public static final String KEY_STATEMENT = "source.statement";
    public static final String KEY_TIME_ENCODING = "source.mysql.time.encoding";

    @Override
    public String id() {
        return ID;
    }

    /**
     * Rows are re-read on every tick; there is nothing to acknowledge.
     */
    @Override
    public boolean canAcknowledge() {
        return false;
    }

    @Override
    public SourceConnector create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        // 1. Validate before anything touches the network
        final String statement = config.requireString(KEY_STATEMENT);
        final MySqlConfig mysql = MySqlConfig.from(config);
        final TimeEncoding timeEncoding = TimeEncoding.parse(config.getOptionalString(KEY_TIME_ENCODING));

        // 2. Build
        final RowMapper rowMapper = new RowMapper(new ValueNormalizer(timeEncoding), metrics);
        log.info("MySQL source configured: {} timeEncoding={}", mysql, timeEncoding);
        return new MySqlSourceConnector(mysql, statement, rowMapper);
    }
}
