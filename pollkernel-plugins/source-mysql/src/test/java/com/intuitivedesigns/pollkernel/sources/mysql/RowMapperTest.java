/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RowMapperTest {

    private final MicrometerMetricsRuntime metrics = MicrometerMetricsRuntime.inMemory();
    private final RowMapper mapper = new RowMapper(new ValueNormalizer(), metrics);

    @Test
    void map_shouldProduceOneEntryPerColumnInOrder() {
        DatabaseRow row = new DatabaseRow(List.of(
                column("id", new DatabaseValue.Int(7)),
                column("name", new DatabaseValue.Bytes("widget".getBytes())),
                column("deleted_at", DatabaseValue.NULL)));

        GenericValue.ObjectValue obj = (GenericValue.ObjectValue) mapper.map(row);

        assertEquals(List.of("id", "name", "deleted_at"), new ArrayList<>(obj.fields().keySet()));
        assertEquals(GenericValue.integer(7), obj.get("id"));
        assertSame(GenericValue.nullValue(), obj.get("deleted_at"));
    }

    @Test
    void map_shouldLetLaterDuplicateColumnWin() {
        DatabaseRow row = new DatabaseRow(List.of(
                column("a", new DatabaseValue.Int(1)),
                column("b", new DatabaseValue.Int(2)),
                column("a", new DatabaseValue.Int(3))));

        GenericValue.ObjectValue obj = (GenericValue.ObjectValue) mapper.map(row);

        assertEquals(2, obj.size());
        assertEquals(GenericValue.integer(3), obj.get("a"));
        assertEquals(GenericValue.integer(2), obj.get("b"));
    }

    @Test
    void map_shouldReplaceFailedColumnWithNullAndCountIt() {
        DatabaseRow row = new DatabaseRow(List.of(
                column("ok", new DatabaseValue.Int(1)),
                column("due", new DatabaseValue.DateTime(2023, 2, 30, 0, 0, 0, 0)),
                column("big", new DatabaseValue.UInt(-1L))));

        GenericValue.ObjectValue obj = (GenericValue.ObjectValue) mapper.map(row);

        assertEquals(3, obj.size());
        assertEquals(GenericValue.integer(1), obj.get("ok"));
        assertSame(GenericValue.nullValue(), obj.get("due"));
        assertSame(GenericValue.nullValue(), obj.get("big"));
        assertEquals(2.0, metrics.registry().get(RowMapper.METRIC_NORMALIZATION_ERRORS).counter().count());
    }

    @Test
    void mapAll_shouldKeepRowOrder() {
        List<DatabaseRow> rows = List.of(
                new DatabaseRow(List.of(column("n", new DatabaseValue.Int(1)))),
                new DatabaseRow(List.of(column("n", new DatabaseValue.Int(2)))));

        List<GenericValue> mapped = mapper.mapAll(rows);

        assertEquals(2, mapped.size());
        assertEquals(GenericValue.integer(2), ((GenericValue.ObjectValue) mapped.get(1)).get("n"));
        assertTrue(mapper.mapAll(List.of()).isEmpty());
    }

    private static DatabaseRow.Column column(String name, DatabaseValue value) {
        return new DatabaseRow.Column(name, value);
    }
}
