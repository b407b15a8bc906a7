/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

import java.util.List;
import java.util.Objects;

/**
 * One materialized result row: columns in driver order, names verbatim.
 */
public record DatabaseRow(List<Column> columns) {

    public DatabaseRow {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    }

    public record Column(String name, DatabaseValue value) {
        public Column {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    public int size() {
        return columns.size();
    }
}
