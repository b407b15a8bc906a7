/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import com.intuitivedesigns.pollkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.pollkernel.value.GenericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns result rows into Object values keyed by column name.
 *
 * <p>A column that fails normalization becomes Null; the rest of the row survives.
 * When two columns share a name the later one wins.</p>
 */
public final class RowMapper {

    private static final Logger log = LoggerFactory.getLogger(RowMapper.class);

    static final String METRIC_NORMALIZATION_ERRORS = "source.mysql.normalization.errors";

    private final ValueNormalizer normalizer;
    private final MetricsRuntime metrics;

    public RowMapper(ValueNormalizer normalizer, MetricsRuntime metrics) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public GenericValue map(DatabaseRow row) {
        Objects.requireNonNull(row, "row");

        final Map<String, GenericValue> fields = new LinkedHashMap<>(row.size() * 2);
        for (DatabaseRow.Column column : row.columns()) {
            fields.put(column.name(), normalizeOrNull(column));
        }
        return GenericValue.object(fields);
    }

    public List<GenericValue> mapAll(List<DatabaseRow> rows) {
        final List<GenericValue> out = new ArrayList<>(rows.size());
        for (DatabaseRow row : rows) {
            out.add(map(row));
        }
        return out;
    }

    private GenericValue normalizeOrNull(DatabaseRow.Column column) {
        try {
            return normalizer.normalize(column.name(), column.value());
        } catch (NormalizationException e) {
            metrics.increment(METRIC_NORMALIZATION_ERRORS);
            log.warn("Column '{}' replaced with null: {}", column.name(), e.getMessage());
            return GenericValue.nullValue();
        }
    }
}
