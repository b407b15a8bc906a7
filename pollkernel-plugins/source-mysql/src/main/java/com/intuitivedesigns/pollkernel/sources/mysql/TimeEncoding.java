/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.core.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * How TIME columns are rendered.
 */
public enum TimeEncoding {

    /**
     * Object {@code {negative, days, hours, minutes, seconds, microseconds}}. Lossless.
     */
    STRUCTURED,

    /**
     * Opaque 6-byte payload {@code [sign, days, hours, minutes, seconds, micros & 0xFF]}.
     * Microseconds are truncated to their low byte.
     */
    PACKED;

    public static TimeEncoding parse(String raw) {
        if (raw == null || raw.isBlank()) return STRUCTURED;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown time encoding '" + raw + "'. Supported: " + Arrays.toString(values()), e);
        }
    }
}
