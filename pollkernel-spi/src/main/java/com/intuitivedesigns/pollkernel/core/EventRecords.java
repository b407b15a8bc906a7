/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import com.intuitivedesigns.pollkernel.value.GenericValue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the one record a tick emits:
 * {@code {"timestamp": <capture instant>, "message": [row, row, ...]}}.
 */
public final class EventRecords {

    public static final String TIMESTAMP_KEY = "timestamp";
    public static final String MESSAGE_KEY = "message";

    // Envelope metadata
    public static final String META_SOURCE_TYPE = "source_type";
    public static final String META_PIPELINE = "pipeline";

    private EventRecords() {}

    public static PipelinePayload<GenericValue> of(Instant capturedAt,
                                                   List<GenericValue> rows,
                                                   String sourceType,
                                                   String pipeline) {
        Objects.requireNonNull(capturedAt, "capturedAt");
        Objects.requireNonNull(rows, "rows");

        final Map<String, GenericValue> fields = new LinkedHashMap<>(4);
        fields.put(TIMESTAMP_KEY, GenericValue.timestamp(capturedAt));
        fields.put(MESSAGE_KEY, GenericValue.array(rows));

        final Map<String, String> meta = new LinkedHashMap<>(4);
        if (sourceType != null) meta.put(META_SOURCE_TYPE, sourceType);
        if (pipeline != null) meta.put(META_PIPELINE, pipeline);

        return PipelinePayload.of(GenericValue.object(fields), capturedAt, meta);
    }
}
