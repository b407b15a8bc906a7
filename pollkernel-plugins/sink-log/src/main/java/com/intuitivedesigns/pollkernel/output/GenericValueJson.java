/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.pollkernel.core.PipelinePayload;
import com.intuitivedesigns.pollkernel.value.GenericValue;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * JSON rendering of generic values.
 *
 * <p>Bytes that are valid UTF-8 become strings, anything else becomes
 * {@code {"base64": "..."}}. Timestamps are ISO-8601 instants.</p>
 */
public final class GenericValueJson {

    static final String BASE64_FIELD = "base64";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper;

    public GenericValueJson() {
        this(new ObjectMapper());
    }

    public GenericValueJson(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public JsonNode toNode(GenericValue value) {
        Objects.requireNonNull(value, "value");

        if (value instanceof GenericValue.NullValue) {
            return NODES.nullNode();
        }
        if (value instanceof GenericValue.BooleanValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof GenericValue.IntegerValue i) {
            return NODES.numberNode(i.value());
        }
        if (value instanceof GenericValue.FloatValue f) {
            return NODES.numberNode(f.value());
        }
        if (value instanceof GenericValue.BytesValue b) {
            return bytesNode(b.value());
        }
        if (value instanceof GenericValue.TimestampValue t) {
            return NODES.textNode(t.value().toString());
        }
        if (value instanceof GenericValue.ArrayValue a) {
            final ArrayNode arr = NODES.arrayNode(a.size());
            for (GenericValue v : a.values()) {
                arr.add(toNode(v));
            }
            return arr;
        }
        final GenericValue.ObjectValue o = (GenericValue.ObjectValue) value;
        final ObjectNode obj = NODES.objectNode();
        for (Map.Entry<String, GenericValue> e : o.fields().entrySet()) {
            obj.set(e.getKey(), toNode(e.getValue()));
        }
        return obj;
    }

    /**
     * Envelope: {@code {"id", "timestamp", "metadata", "data"}}.
     */
    public ObjectNode toNode(PipelinePayload<GenericValue> payload) {
        Objects.requireNonNull(payload, "payload");

        final ObjectNode root = NODES.objectNode();
        root.put("id", payload.id());
        root.put("timestamp", payload.timestamp().toString());
        final ObjectNode meta = root.putObject("metadata");
        payload.metadata().forEach(meta::put);
        root.set("data", payload.data() != null ? toNode(payload.data()) : NODES.nullNode());
        return root;
    }

    public String write(JsonNode node, boolean pretty) throws JsonProcessingException {
        return pretty
                ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                : mapper.writeValueAsString(node);
    }

    // --- Helpers ---

    private static JsonNode bytesNode(byte[] bytes) {
        try {
            final String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return NODES.textNode(text);
        } catch (CharacterCodingException e) {
            final ObjectNode wrapped = NODES.objectNode();
            wrapped.put(BASE64_FIELD, Base64.getEncoder().encodeToString(bytes));
            return wrapped;
        }
    }
}
