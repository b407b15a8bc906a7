/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import java.util.Arrays;
import java.util.Objects;

/**
 * A column value as the MySQL wire protocol represents it, before normalization.
 *
 * <p>With the text protocol every non-null scalar arrives as {@link Bytes}; the
 * binary (prepared statement) protocol yields the typed variants.</p>
 */
public sealed interface DatabaseValue
        permits DatabaseValue.Null,
                DatabaseValue.Bytes,
                DatabaseValue.Int,
                DatabaseValue.UInt,
                DatabaseValue.Float32,
                DatabaseValue.Float64,
                DatabaseValue.DateTime,
                DatabaseValue.Time {

    Null NULL = new Null();

    record Null() implements DatabaseValue {}

    record Bytes(byte[] value) implements DatabaseValue {
        public Bytes {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes[length=" + value.length + "]";
        }
    }

    /** Signed 64-bit integer. */
    record Int(long value) implements DatabaseValue {}

    /** Unsigned 64-bit integer; {@code bits} is read as unsigned. */
    record UInt(long bits) implements DatabaseValue {
        @Override
        public String toString() {
            return "UInt[" + Long.toUnsignedString(bits) + "]";
        }
    }

    /** Single precision FLOAT. */
    record Float32(float value) implements DatabaseValue {}

    /** DOUBLE. */
    record Float64(double value) implements DatabaseValue {}

    /**
     * DATE / DATETIME / TIMESTAMP wall-clock fields, unvalidated.
     * Zero dates ({@code 0000-00-00}) are representable here on purpose.
     */
    record DateTime(int year, int month, int day,
                    int hour, int minute, int second, int micros) implements DatabaseValue {}

    /**
     * TIME: a signed duration up to 838:59:59, split into days and a remainder.
     */
    record Time(boolean negative, int days, int hours,
                int minutes, int seconds, int micros) implements DatabaseValue {}
}
