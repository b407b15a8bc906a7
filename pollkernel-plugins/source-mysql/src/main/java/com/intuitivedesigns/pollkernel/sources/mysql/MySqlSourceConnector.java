/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.core.ConnectionException;
import com.intuitivedesigns.pollkernel.core.SourceConnector;
import com.intuitivedesigns.pollkernel.core.SourceException;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs one fixed statement per poll and maps every row.
 *
 * <p>The pool is created on {@link #connect()}, not at construction.</p>
 */
public final class MySqlSourceConnector implements SourceConnector {

    private static final Logger log = LoggerFactory.getLogger(MySqlSourceConnector.class);

    public static final String TYPE = "MYSQL";

    private final MySqlConfig config;
    private final String statement;
    private final RowMapper rowMapper;

    private volatile ConnectionManager connections;

    public MySqlSourceConnector(MySqlConfig config, String statement, RowMapper rowMapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.statement = Objects.requireNonNull(statement, "statement");
        this.rowMapper = Objects.requireNonNull(rowMapper, "rowMapper");
    }

    @Override
    public synchronized void connect() {
        if (connections != null && !connections.isClosed()) return;

        log.info("Connecting MySQL source to {}:{}/{}", config.host(), config.port(),
                (config.database() != null ? config.database() : ""));
        connections = new ConnectionManager(config.jdbcUrl(), config.user(), config.password(),
                "pollkernel-mysql-" + config.host() + "-" + config.port());
    }

    @Override
    public synchronized void disconnect() {
        final ConnectionManager cm = connections;
        connections = null;
        if (cm != null) {
            cm.close();
        }
    }

    @Override
    public List<GenericValue> poll() throws SourceException {
        final ConnectionManager cm = connections;
        if (cm == null) {
            throw new ConnectionException("MySQL source is not connected");
        }
        return rowMapper.mapAll(cm.execute(statement));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
