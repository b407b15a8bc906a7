/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import java.util.List;

/**
 * Where a pipeline hands its records.
 *
 * <p>{@link #writeBatch(List)} returns once the batch is accepted; a slow sink slows
 * the poll loop down and nothing is buffered in between. Any exception is fatal for
 * the owning pipeline. One sink instance belongs to one pipeline and is called from
 * that pipeline's thread only.</p>
 *
 * @param <T> record body type
 */
public interface OutputSink<T> extends AutoCloseable {

    void write(PipelinePayload<T> payload) throws Exception;

    /**
     * Writes the batch in order. The poll loop sends one record per tick.
     */
    default void writeBatch(List<PipelinePayload<T>> batch) throws Exception {
        for (PipelinePayload<T> payload : batch) {
            write(payload);
        }
    }

    /**
     * Short name for logs, e.g. {@code log}.
     */
    default String id() {
        return getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {}
}
