/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The structurally generic value model every source emits.
 *
 * <p>The variant set is closed: downstream code can switch over it exhaustively.
 * All variants are immutable and safe to share between threads.</p>
 *
 * <p><b>Invariant:</b> a {@link FloatValue} never holds NaN. Use {@link #checkedFloat(double)}
 * (or the record constructor, which enforces the same rule) when the input is untrusted.</p>
 */
public sealed interface GenericValue
        permits GenericValue.NullValue,
                GenericValue.BooleanValue,
                GenericValue.IntegerValue,
                GenericValue.FloatValue,
                GenericValue.BytesValue,
                GenericValue.TimestampValue,
                GenericValue.ArrayValue,
                GenericValue.ObjectValue {

    // -----------------------------------------------------------------------
    // 1. FACTORY METHODS
    // -----------------------------------------------------------------------

    static GenericValue nullValue() {
        return NullValue.INSTANCE;
    }

    static GenericValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static GenericValue integer(long value) {
        return new IntegerValue(value);
    }

    /**
     * Builds a Float, rejecting NaN.
     *
     * @throws IllegalArgumentException if {@code value} is NaN
     */
    static GenericValue checkedFloat(double value) {
        return new FloatValue(value);
    }

    static GenericValue bytes(byte[] value) {
        return new BytesValue(value);
    }

    static GenericValue timestamp(Instant value) {
        return new TimestampValue(value);
    }

    static GenericValue array(List<? extends GenericValue> values) {
        return new ArrayValue(new ArrayList<>(values));
    }

    static GenericValue object(Map<String, ? extends GenericValue> fields) {
        return new ObjectValue(new LinkedHashMap<>(fields));
    }

    // -----------------------------------------------------------------------
    // 2. VARIANTS
    // -----------------------------------------------------------------------

    final class NullValue implements GenericValue {
        static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override
        public String toString() {
            return "null";
        }
    }

    record BooleanValue(boolean value) implements GenericValue {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);
    }

    record IntegerValue(long value) implements GenericValue {}

    record FloatValue(double value) implements GenericValue {
        public FloatValue {
            if (Double.isNaN(value)) {
                throw new IllegalArgumentException("Float value must not be NaN");
            }
        }
    }

    /**
     * Opaque byte payload. The array is copied on the way in and on the way out.
     */
    record BytesValue(byte[] value) implements GenericValue {
        public BytesValue {
            Objects.requireNonNull(value, "value");
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[length=" + value.length + "]";
        }
    }

    record TimestampValue(Instant value) implements GenericValue {
        public TimestampValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record ArrayValue(List<GenericValue> values) implements GenericValue {
        public ArrayValue {
            Objects.requireNonNull(values, "values");
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public int size() {
            return values.size();
        }

        public GenericValue get(int index) {
            return values.get(index);
        }
    }

    /**
     * String-keyed mapping. Keys are unique and iteration follows insertion order.
     */
    record ObjectValue(Map<String, GenericValue> fields) implements GenericValue {
        public ObjectValue {
            Objects.requireNonNull(fields, "fields");
            // Map.copyOf() would lose insertion order
            final Map<String, GenericValue> copy = new LinkedHashMap<>(fields.size() * 2);
            for (Map.Entry<String, GenericValue> e : fields.entrySet()) {
                copy.put(Objects.requireNonNull(e.getKey(), "field name"),
                        Objects.requireNonNull(e.getValue(), "field value"));
            }
            fields = Collections.unmodifiableMap(copy);
        }

        public GenericValue get(String key) {
            return fields.get(key);
        }

        public int size() {
            return fields.size();
        }
    }
}
