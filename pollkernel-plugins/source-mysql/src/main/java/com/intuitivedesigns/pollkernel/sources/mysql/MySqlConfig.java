/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;
import com.intuitivedesigns.pollkernel.core.ConfigurationException;

import java.util.Objects;

/**
 * MySQL connection coordinates.
 */
public record MySqlConfig(String host, int port, String database, String user, String password) {

    // Config Keys
    public static final String KEY_HOST = "source.mysql.host";
    public static final String KEY_PORT = "source.mysql.port";
    public static final String KEY_DATABASE = "source.mysql.database";
    public static final String KEY_USER = "source.mysql.user";
    public static final String KEY_PASSWORD = "source.mysql.password";

    // Defaults
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 3306;

    public MySqlConfig {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("MySQL host must not be blank");
        }
        if (port < 1 || port > 65_535) {
            throw new ConfigurationException("Invalid MySQL port: " + port);
        }
        host = host.trim();
    }

    public static MySqlConfig from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        return new MySqlConfig(
                config.getString(KEY_HOST, DEFAULT_HOST),
                config.getInt(KEY_PORT, DEFAULT_PORT),
                config.getOptionalString(KEY_DATABASE),
                config.getOptionalString(KEY_USER),
                config.getOptionalString(KEY_PASSWORD));
    }

    /**
     * Server-side prepared statements, no client statement cache.
     */
    public String jdbcUrl() {
        return "jdbc:mysql://" + host + ":" + port + "/" + (database != null ? database : "")
                + "?useServerPrepStmts=true&cachePrepStmts=false";
    }

    @Override
    public String toString() {
        return "MySqlConfig[host=" + host + ", port=" + port + ", database=" + database
                + ", user=" + user + ", password=" + (password != null ? "****" : null) + "]";
    }
}
