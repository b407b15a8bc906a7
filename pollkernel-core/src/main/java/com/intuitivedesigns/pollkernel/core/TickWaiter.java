/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import java.time.Duration;

/**
 * The loop's only sleeping primitive. Production code binds it to
 * {@link ShutdownSignal#await(Duration)}; tests bind it to a virtual clock.
 */
@FunctionalInterface
interface TickWaiter {

    /**
     * @return {@code true} if shutdown won the race
     */
    boolean awaitShutdown(Duration delay) throws InterruptedException;
}
