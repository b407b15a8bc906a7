/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

public enum PollState {
    /** Sleeping until the next fire time (or shutdown). */
    WAITING,
    /** Connection acquired, statement executing. */
    QUERYING,
    /** Record handed to the sink. */
    EMITTING,
    /** Terminal. */
    SHUTTING_DOWN
}
