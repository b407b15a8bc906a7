/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.value.GenericValue;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts one {@link DatabaseValue} into a {@link GenericValue}.
 *
 * <ul>
 * <li>Null, Bytes and signed Int map one-to-one.</li>
 * <li>UInt maps to Integer only when it fits in a signed 64-bit value.</li>
 * <li>Float and Double map to Float; NaN is rejected.</li>
 * <li>DateTime is read as UTC wall-clock time and must be a real calendar date.</li>
 * <li>Time follows the configured {@link TimeEncoding}.</li>
 * </ul>
 *
 * Stateless and thread-safe.
 */
public final class ValueNormalizer {

    // Structured TIME field names
    static final String TIME_NEGATIVE = "negative";
    static final String TIME_DAYS = "days";
    static final String TIME_HOURS = "hours";
    static final String TIME_MINUTES = "minutes";
    static final String TIME_SECONDS = "seconds";
    static final String TIME_MICROS = "microseconds";

    private static final int MAX_MICROS = 999_999;

    private final TimeEncoding timeEncoding;

    public ValueNormalizer() {
        this(TimeEncoding.STRUCTURED);
    }

    public ValueNormalizer(TimeEncoding timeEncoding) {
        this.timeEncoding = Objects.requireNonNull(timeEncoding, "timeEncoding");
    }

    /**
     * @param column column name, used only in error messages
     * @throws NormalizationException when the value has no faithful generic form
     */
    public GenericValue normalize(String column, DatabaseValue value) throws NormalizationException {
        Objects.requireNonNull(value, "value");

        if (value instanceof DatabaseValue.Null) {
            return GenericValue.nullValue();
        }
        if (value instanceof DatabaseValue.Bytes b) {
            return GenericValue.bytes(b.value());
        }
        if (value instanceof DatabaseValue.Int i) {
            return GenericValue.integer(i.value());
        }
        if (value instanceof DatabaseValue.UInt u) {
            // Unsigned values above Long.MAX_VALUE wrap to negative bits
            if (u.bits() < 0) {
                throw new NormalizationException(column,
                        "Unsigned value " + Long.toUnsignedString(u.bits()) + " out of range for a signed 64-bit integer");
            }
            return GenericValue.integer(u.bits());
        }
        if (value instanceof DatabaseValue.Float32 f) {
            return toFloat(column, f.value());
        }
        if (value instanceof DatabaseValue.Float64 d) {
            return toFloat(column, d.value());
        }
        if (value instanceof DatabaseValue.DateTime dt) {
            return toTimestamp(column, dt);
        }
        if (value instanceof DatabaseValue.Time t) {
            return timeEncoding == TimeEncoding.PACKED ? packTime(t) : structureTime(t);
        }
        throw new NormalizationException(column, "Unsupported value type " + value.getClass().getSimpleName());
    }

    // --- Helpers ---

    private static GenericValue toFloat(String column, double value) throws NormalizationException {
        try {
            return GenericValue.checkedFloat(value);
        } catch (IllegalArgumentException e) {
            throw new NormalizationException(column, "NaN is not representable", e);
        }
    }

    private static GenericValue toTimestamp(String column, DatabaseValue.DateTime dt) throws NormalizationException {
        if (dt.micros() < 0 || dt.micros() > MAX_MICROS) {
            throw new NormalizationException(column, "Invalid date");
        }
        try {
            final LocalDateTime local = LocalDateTime.of(
                    dt.year(), dt.month(), dt.day(),
                    dt.hour(), dt.minute(), dt.second(), dt.micros() * 1_000);
            return GenericValue.timestamp(local.toInstant(ZoneOffset.UTC));
        } catch (DateTimeException e) {
            throw new NormalizationException(column, "Invalid date", e);
        }
    }

    private static GenericValue structureTime(DatabaseValue.Time t) {
        final Map<String, GenericValue> fields = new LinkedHashMap<>();
        fields.put(TIME_NEGATIVE, GenericValue.bool(t.negative()));
        fields.put(TIME_DAYS, GenericValue.integer(t.days()));
        fields.put(TIME_HOURS, GenericValue.integer(t.hours()));
        fields.put(TIME_MINUTES, GenericValue.integer(t.minutes()));
        fields.put(TIME_SECONDS, GenericValue.integer(t.seconds()));
        fields.put(TIME_MICROS, GenericValue.integer(t.micros()));
        return GenericValue.object(fields);
    }

    private static GenericValue packTime(DatabaseValue.Time t) {
        return GenericValue.bytes(new byte[] {
                (byte) (t.negative() ? 1 : 0),
                (byte) t.days(),
                (byte) t.hours(),
                (byte) t.minutes(),
                (byte) t.seconds(),
                (byte) t.micros()
        });
    }
}
