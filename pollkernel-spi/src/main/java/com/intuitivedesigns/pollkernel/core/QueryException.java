/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.core;

/**
 * The statement was malformed, rejected by the server, or failed while executing.
 */
public class QueryException extends SourceException {

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
