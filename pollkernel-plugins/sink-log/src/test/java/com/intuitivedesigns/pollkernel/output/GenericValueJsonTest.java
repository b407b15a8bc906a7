/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.pollkernel.core.EventRecords;
import com.intuitivedesigns.pollkernel.core.PipelinePayload;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GenericValueJsonTest {

    private final GenericValueJson json = new GenericValueJson();

    @Test
    void toNode_shouldRenderScalars() {
        assertTrue(json.toNode(GenericValue.nullValue()).isNull());
        assertTrue(json.toNode(GenericValue.bool(true)).booleanValue());
        assertEquals(Long.MAX_VALUE, json.toNode(GenericValue.integer(Long.MAX_VALUE)).longValue());
        assertEquals(0.25, json.toNode(GenericValue.checkedFloat(0.25)).doubleValue());
        assertEquals("2024-01-01T00:10:00Z", json.toNode(GenericValue.timestamp(Instant.parse("2024-01-01T00:10:00Z"))).textValue());
    }

    @Test
    void toNode_shouldRenderUtf8BytesAsText() {
        JsonNode node = json.toNode(GenericValue.bytes("héllo".getBytes(StandardCharsets.UTF_8)));

        assertTrue(node.isTextual());
        assertEquals("héllo", node.textValue());
    }

    @Test
    void toNode_shouldFallBackToBase64ForBinary() {
        JsonNode node = json.toNode(GenericValue.bytes(new byte[] {(byte) 0xFF, (byte) 0xFE, 0x00}));

        assertTrue(node.isObject());
        assertEquals("//4A", node.get(GenericValueJson.BASE64_FIELD).textValue());
    }

    @Test
    void toNode_shouldKeepObjectFieldOrder() throws Exception {
        Map<String, GenericValue> fields = new LinkedHashMap<>();
        fields.put("z", GenericValue.integer(1));
        fields.put("a", GenericValue.array(List.of(GenericValue.integer(2), GenericValue.nullValue())));

        String text = json.write(json.toNode(GenericValue.object(fields)), false);

        assertEquals("{\"z\":1,\"a\":[2,null]}", text);
    }

    @Test
    void toNode_shouldWrapPayloadEnvelope() {
        Instant at = Instant.parse("2024-01-01T00:10:00Z");
        PipelinePayload<GenericValue> record = EventRecords.of(at,
                List.of(GenericValue.object(Map.of("count", GenericValue.integer(42)))), "MYSQL", "default");

        JsonNode node = json.toNode(record);

        assertEquals(record.id(), node.get("id").textValue());
        assertEquals("2024-01-01T00:10:00Z", node.get("timestamp").textValue());
        assertEquals("MYSQL", node.get("metadata").get("source_type").textValue());
        assertEquals(42, node.get("data").get("message").get(0).get("count").intValue());
        assertEquals("2024-01-01T00:10:00Z", node.get("data").get("timestamp").textValue());
    }
}
