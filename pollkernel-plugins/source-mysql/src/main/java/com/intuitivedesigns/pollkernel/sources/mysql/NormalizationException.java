/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.sources.mysql;

/**
 * A column value has no faithful representation in the generic value model.
 */
public class NormalizationException extends Exception {

    private final String column;

    public NormalizationException(String column, String reason) {
        super(reason + ": " + column);
        this.column = column;
    }

    public NormalizationException(String column, String reason, Throwable cause) {
        super(reason + ": " + column, cause);
        this.column = column;
    }

    public String column() {
        return column;
    }
}
