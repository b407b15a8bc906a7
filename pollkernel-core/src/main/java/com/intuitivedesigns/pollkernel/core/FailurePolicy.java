/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import com.intuitivedesigns.pollkernel.config.PipelineConfig;

/**
 * What the poll loop does when a tick fails to produce rows.
 *
 * <p>Fail-fast (the default) ends the pipeline on the first failure. Otherwise the
 * loop backs off exponentially between {@code backoffInitialMs} and
 * {@code backoffMaxMs}, resumes with the next scheduled tick, and gives up once
 * {@code maxConsecutiveFailures} ticks in a row have failed.</p>
 */
public record FailurePolicy(boolean failFast,
                            long backoffInitialMs,
                            long backoffMaxMs,
                            int maxConsecutiveFailures) {

    // Config keys
    public static final String KEY_FAIL_FAST = "pipeline.source.fail.fast";
    public static final String KEY_BACKOFF_INITIAL_MS = "pipeline.source.backoff.initial.ms";
    public static final String KEY_BACKOFF_MAX_MS = "pipeline.source.backoff.max.ms";
    public static final String KEY_MAX_CONSECUTIVE_FAILURES = "pipeline.source.max.consecutive.failures";

    // Defaults
    private static final long DEFAULT_BACKOFF_INITIAL_MS = 250L;
    private static final long DEFAULT_BACKOFF_MAX_MS = 5_000L;
    private static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 5;

    public static final FailurePolicy FAIL_FAST = new FailurePolicy(
            true, DEFAULT_BACKOFF_INITIAL_MS, DEFAULT_BACKOFF_MAX_MS, DEFAULT_MAX_CONSECUTIVE_FAILURES);

    public FailurePolicy {
        if (backoffInitialMs < 0) throw new ConfigurationException(KEY_BACKOFF_INITIAL_MS + " must be >= 0");
        if (backoffMaxMs < backoffInitialMs) {
            throw new ConfigurationException(KEY_BACKOFF_MAX_MS + " must be >= " + KEY_BACKOFF_INITIAL_MS);
        }
        if (maxConsecutiveFailures < 1) throw new ConfigurationException(KEY_MAX_CONSECUTIVE_FAILURES + " must be >= 1");
    }

    public static FailurePolicy from(PipelineConfig config) {
        return new FailurePolicy(
                config.getBoolean(KEY_FAIL_FAST, true),
                config.getLong(KEY_BACKOFF_INITIAL_MS, DEFAULT_BACKOFF_INITIAL_MS),
                config.getLong(KEY_BACKOFF_MAX_MS, DEFAULT_BACKOFF_MAX_MS),
                config.getInt(KEY_MAX_CONSECUTIVE_FAILURES, DEFAULT_MAX_CONSECUTIVE_FAILURES));
    }

    /**
     * Backoff before resuming after the {@code consecutiveFailures}-th failure in a row (1-based).
     */
    public long backoffMillis(int consecutiveFailures) {
        long backoff = backoffInitialMs;
        for (int i = 1; i < consecutiveFailures && backoff < backoffMaxMs; i++) {
            backoff = backoff * 2;
        }
        return Math.min(backoff, backoffMaxMs);
    }
}
