/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventRecordsTest {

    @Test
    void of_shouldWrapRowsWithCaptureTimestamp() {
        Instant capturedAt = Instant.parse("2024-01-01T00:10:00Z");
        GenericValue row = GenericValue.object(Map.of("count", GenericValue.integer(42)));

        PipelinePayload<GenericValue> record = EventRecords.of(capturedAt, List.of(row), "MYSQL", "default");

        GenericValue.ObjectValue data = assertInstanceOf(GenericValue.ObjectValue.class, record.data());
        assertEquals(2, data.size());
        assertEquals(GenericValue.timestamp(capturedAt), data.get(EventRecords.TIMESTAMP_KEY));

        GenericValue.ArrayValue message = assertInstanceOf(GenericValue.ArrayValue.class, data.get(EventRecords.MESSAGE_KEY));
        assertEquals(1, message.size());
        assertEquals(row, message.get(0));

        assertEquals(capturedAt, record.timestamp());
        assertEquals("MYSQL", record.metadata(EventRecords.META_SOURCE_TYPE));
        assertEquals("default", record.metadata(EventRecords.META_PIPELINE));
    }

    @Test
    void of_shouldEmitEmptyMessageForZeroRows() {
        PipelinePayload<GenericValue> record = EventRecords.of(Instant.EPOCH, List.of(), "MYSQL", "p");

        GenericValue.ObjectValue data = (GenericValue.ObjectValue) record.data();
        assertEquals(0, ((GenericValue.ArrayValue) data.get(EventRecords.MESSAGE_KEY)).size());
    }

    @Test
    void of_shouldGiveEveryRecordAFreshId() {
        PipelinePayload<GenericValue> a = EventRecords.of(Instant.EPOCH, List.of(), "MYSQL", "p");
        PipelinePayload<GenericValue> b = EventRecords.of(Instant.EPOCH, List.of(), "MYSQL", "p");
        assertNotEquals(a.id(), b.id());
    }
}
