/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import com.intuitivedesigns.pollkernel.value.GenericValue;

import java.util.List;

/**
 * A pluggable, tick-driven source of rows for the poll loop.
 *
 * <p>The poll loop owns the schedule; the connector only knows how to run
 * one tick. Each call to {@link #poll()} executes the configured work once
 * and returns the complete, materialized result.</p>
 */
public interface SourceConnector extends AutoCloseable {

    /**
     * Allocate long-lived resources (connection pools). Must not block on the
     * network: connections are established lazily by the first {@link #poll()}.
     */
    void connect();

    /**
     * Release everything {@link #connect()} allocated. Safe to call twice.
     */
    void disconnect();

    /**
     * Run one tick.
     *
     * @return one {@link GenericValue.ObjectValue} per result row, in result order
     * @throws ConnectionException if no connection could be obtained
     * @throws QueryException if the statement could not be prepared or executed
     */
    List<GenericValue> poll() throws SourceException;

    /**
     * Whether records from this source can be acknowledged end-to-end.
     */
    default boolean canAcknowledge() {
        return false;
    }

    /**
     * Short identifier used as the {@code source_type} metadata of emitted records.
     */
    default String type() {
        return getClass().getSimpleName();
    }

    @Override
    default void close() {
        disconnect();
    }
}
