/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.core.ConnectionException;
import com.intuitivedesigns.pollkernel.core.QueryException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A HikariCP pool of exactly one connection.
 *
 * <p>Capacity 1 means two queries against the same source can never overlap.
 * A caller that cannot get the connection within the acquire timeout gets a
 * {@link ConnectionException}. Nothing is opened at construction: the connection
 * is created by the first acquire, which is also where an unreachable database
 * is reported.</p>
 */
public final class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(3);

    // Hikari ignores connection timeouts below this floor
    private static final long MIN_TIMEOUT_MS = 250;

    private final HikariDataSource dataSource;
    private final Duration acquireTimeout;

    public ConnectionManager(String jdbcUrl, String user, String password, String poolName) {
        this(jdbcUrl, user, password, poolName, DEFAULT_ACQUIRE_TIMEOUT);
    }

    public ConnectionManager(String jdbcUrl, String user, String password, String poolName, Duration acquireTimeout) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        final long timeoutMs = Math.max(MIN_TIMEOUT_MS, acquireTimeout.toMillis());
        this.acquireTimeout = Duration.ofMillis(timeoutMs);

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(jdbcUrl);
        if (user != null) hikari.setUsername(user);
        if (password != null) hikari.setPassword(password);

        // At most one connection, opened by the first acquire()
        hikari.setMaximumPoolSize(1);
        hikari.setMinimumIdle(0);
        hikari.setConnectionTimeout(timeoutMs);
        hikari.setValidationTimeout(Math.max(MIN_TIMEOUT_MS, timeoutMs / 2));
        hikari.setAutoCommit(true);
        hikari.setPoolName(poolName);

        // Do not block or fail at construction; connect lazily
        hikari.setInitializationFailTimeout(-1);

        this.dataSource = new HikariDataSource(hikari);
        log.info("Connection pool '{}' ready (size=1, acquireTimeout={}ms)", poolName, timeoutMs);
    }

    /**
     * Physical connections currently held by the pool, idle or in use.
     */
    int openConnections() {
        return dataSource.getHikariPoolMXBean().getTotalConnections();
    }

    public Duration acquireTimeout() {
        return acquireTimeout;
    }

    /**
     * Borrow the pooled connection. Close it to return it.
     */
    public Connection acquire() throws ConnectionException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException("Could not acquire a connection within "
                    + acquireTimeout.toMillis() + "ms from pool '" + dataSource.getPoolName() + "': " + e.getMessage(), e);
        }
    }

    /**
     * Prepare and run {@code statement} on the pooled connection and read every row.
     * A statement that produces no result set yields no rows.
     */
    public List<DatabaseRow> execute(String statement) throws ConnectionException, QueryException {
        Objects.requireNonNull(statement, "statement");

        try (Connection conn = acquire()) {
            try (PreparedStatement ps = conn.prepareStatement(statement)) {
                if (!ps.execute()) {
                    return List.of();
                }
                try (ResultSet rs = ps.getResultSet()) {
                    return ResultSetReader.readAll(rs);
                }
            } catch (SQLException e) {
                throw new QueryException("Query failed: " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            throw new ConnectionException("Failed to release connection to pool '" + dataSource.getPoolName() + "'", e);
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Connection pool '{}' closed", dataSource.getPoolName());
        }
    }
}
