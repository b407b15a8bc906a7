/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.schedule;

/**
 * A schedule produced no future fire time. Fatal to the pipeline.
 */
public class ScheduleComputationException extends IllegalStateException {

    public ScheduleComputationException(String message) {
        super(message);
    }
}
