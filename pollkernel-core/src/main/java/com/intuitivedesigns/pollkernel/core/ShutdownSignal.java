/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot, edge-triggered cancellation signal observed cooperatively by a poll loop.
 *
 * <p>Once raised it stays raised. Waiting on it doubles as the loop's timer:
 * {@link #await(Duration)} races the delay against the signal.</p>
 */
public final class ShutdownSignal {

    private static final Duration MAX_WAIT = Duration.ofNanos(Long.MAX_VALUE);

    private final CountDownLatch latch = new CountDownLatch(1);

    public void raise() {
        latch.countDown();
    }

    public boolean isRaised() {
        return latch.getCount() == 0;
    }

    /**
     * Sleep for {@code delay} unless the signal is raised first.
     *
     * @return {@code true} if the signal was raised (before or during the wait),
     *         {@code false} if the full delay elapsed
     */
    public boolean await(Duration delay) throws InterruptedException {
        if (delay.isNegative() || delay.isZero()) {
            return isRaised();
        }
        final long nanos = (delay.compareTo(MAX_WAIT) >= 0) ? Long.MAX_VALUE : delay.toNanos();
        return latch.await(nanos, TimeUnit.NANOSECONDS);
    }
}
