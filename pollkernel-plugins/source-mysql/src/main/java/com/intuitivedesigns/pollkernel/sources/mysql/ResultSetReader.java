/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Materializes a JDBC result set into {@link DatabaseRow}s.
 *
 * <p>Temporal columns are read through their string form so zero dates and
 * out-of-range values reach the normalizer instead of failing inside the driver.</p>
 */
final class ResultSetReader {

    private static final Pattern DATE_TIME = Pattern.compile(
            "(-?\\d{1,4})-(\\d{1,2})-(\\d{1,2})(?:[ T](\\d{1,2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,9}))?)?");

    private static final Pattern TIME = Pattern.compile(
            "(-)?(\\d{1,6}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,9}))?");

    private ResultSetReader() {}

    static List<DatabaseRow> readAll(ResultSet rs) throws SQLException {
        final ResultSetMetaData md = rs.getMetaData();
        final int n = md.getColumnCount();

        final String[] names = new String[n];
        final int[] types = new int[n];
        final boolean[] signed = new boolean[n];
        final int[] precision = new int[n];
        for (int i = 0; i < n; i++) {
            names[i] = md.getColumnLabel(i + 1);
            types[i] = md.getColumnType(i + 1);
            signed[i] = md.isSigned(i + 1);
            precision[i] = md.getPrecision(i + 1);
        }

        final List<DatabaseRow> rows = new ArrayList<>();
        while (rs.next()) {
            final List<DatabaseRow.Column> columns = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                columns.add(new DatabaseRow.Column(names[i], read(rs, i + 1, types[i], signed[i], precision[i])));
            }
            rows.add(new DatabaseRow(columns));
        }
        return rows;
    }

    /**
     * @param precision column precision; for {@code BIT} it is the bit width
     */
    static DatabaseValue read(ResultSet rs, int index, int sqlType, boolean signed, int precision) throws SQLException {
        switch (sqlType) {
            case Types.BIT:
                if (precision > 1) {
                    // BIT(n): the driver's getBoolean collapses any non-zero field to true
                    final byte[] bits = rs.getBytes(index);
                    return bits == null ? DatabaseValue.NULL : new DatabaseValue.Bytes(bits);
                }
                // BIT(1) and TINYINT(1) read as booleans
            case Types.BOOLEAN: {
                final boolean b = rs.getBoolean(index);
                return rs.wasNull() ? DatabaseValue.NULL : new DatabaseValue.Int(b ? 1 : 0);
            }
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER: {
                final long v = rs.getLong(index);
                if (rs.wasNull()) return DatabaseValue.NULL;
                return signed ? new DatabaseValue.Int(v) : new DatabaseValue.UInt(v);
            }
            case Types.BIGINT: {
                if (signed) {
                    final long v = rs.getLong(index);
                    return rs.wasNull() ? DatabaseValue.NULL : new DatabaseValue.Int(v);
                }
                // BIGINT UNSIGNED may exceed Long.MAX_VALUE; keep the raw 64 bits
                final BigDecimal d = rs.getBigDecimal(index);
                return d == null ? DatabaseValue.NULL : new DatabaseValue.UInt(d.toBigInteger().longValue());
            }
            case Types.REAL: {
                final float f = rs.getFloat(index);
                return rs.wasNull() ? DatabaseValue.NULL : new DatabaseValue.Float32(f);
            }
            case Types.FLOAT:
            case Types.DOUBLE: {
                final double d = rs.getDouble(index);
                return rs.wasNull() ? DatabaseValue.NULL : new DatabaseValue.Float64(d);
            }
            case Types.DATE:
            case Types.TIMESTAMP: {
                final String s = rs.getString(index);
                return s == null ? DatabaseValue.NULL : parseDateTime(s);
            }
            case Types.TIME: {
                final String s = rs.getString(index);
                return s == null ? DatabaseValue.NULL : parseTime(s);
            }
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB: {
                final byte[] bytes = rs.getBytes(index);
                return bytes == null ? DatabaseValue.NULL : new DatabaseValue.Bytes(bytes);
            }
            default: {
                // DECIMAL, text, JSON, ENUM, SET: the driver's textual form
                final String s = rs.getString(index);
                return s == null ? DatabaseValue.NULL : text(s);
            }
        }
    }

    /**
     * Parses {@code YYYY-MM-DD[ hh:mm:ss[.ffffff]]}. Anything else is kept as text.
     */
    static DatabaseValue parseDateTime(String raw) {
        final Matcher m = DATE_TIME.matcher(raw.trim());
        if (!m.matches()) return text(raw);

        return new DatabaseValue.DateTime(
                Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                intOrZero(m.group(4)),
                intOrZero(m.group(5)),
                intOrZero(m.group(6)),
                micros(m.group(7)));
    }

    /**
     * Parses {@code [-]hhh:mm:ss[.ffffff]}, splitting whole days out of the hours.
     */
    static DatabaseValue parseTime(String raw) {
        final Matcher m = TIME.matcher(raw.trim());
        if (!m.matches()) return text(raw);

        final int totalHours = Integer.parseInt(m.group(2));
        return new DatabaseValue.Time(
                m.group(1) != null,
                totalHours / 24,
                totalHours % 24,
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)),
                micros(m.group(5)));
    }

    // --- Helpers ---

    private static DatabaseValue text(String s) {
        return new DatabaseValue.Bytes(s.getBytes(StandardCharsets.UTF_8));
    }

    private static int intOrZero(String s) {
        return s == null ? 0 : Integer.parseInt(s);
    }

    private static int micros(String fraction) {
        if (fraction == null) return 0;
        final String six = (fraction + "000000").substring(0, 6);
        return Integer.parseInt(six);
    }
}
