/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * What a sink receives: the data of one tick plus its correlation id, capture
 * instant and string metadata (source type, pipeline name).
 *
 * <p>Metadata keeps insertion order and cannot be modified after construction.</p>
 *
 * @param id        correlation id, unique per emitted record
 * @param data      the record body
 * @param timestamp when the tick captured its rows
 * @param metadata  envelope attributes, never null
 */
public record PipelinePayload<T>(String id, T data, Instant timestamp, Map<String, String> metadata) {

    public PipelinePayload {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = (metadata == null || metadata.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * New payload with a random correlation id.
     */
    public static <T> PipelinePayload<T> of(T data, Instant timestamp, Map<String, String> metadata) {
        return new PipelinePayload<>(UUID.randomUUID().toString(), data, timestamp, metadata);
    }

    /**
     * @return the metadata value, or {@code null} when absent
     */
    public String metadata(String key) {
        return metadata.get(key);
    }
}
