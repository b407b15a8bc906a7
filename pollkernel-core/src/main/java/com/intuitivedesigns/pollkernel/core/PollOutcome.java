/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

/**
 * How a poll loop ended.
 *
 * @param status         terminal status
 * @param ticks          ticks started (successful or not)
 * @param recordsEmitted records accepted by the sink
 * @param failure        the fatal error for {@link Status#FAILED}, otherwise {@code null}
 */
public record PollOutcome(Status status, long ticks, long recordsEmitted, Throwable failure) {

    public enum Status {
        /** Unscheduled pipeline ran its single tick. */
        COMPLETED,
        /** Shutdown signal observed. */
        STOPPED,
        /** Connection, query, sink or schedule failure ended the loop. */
        FAILED
    }

    public boolean failed() {
        return status == Status.FAILED;
    }
}
