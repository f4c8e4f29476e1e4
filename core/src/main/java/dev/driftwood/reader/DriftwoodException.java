/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

/**
 * Base class of all failures while reading a JSON Lines stream into a table.
 * <p>
 * Any such failure aborts the whole {@link JsonTableReader#read()} call; no partial table
 * is produced.
 * </p>
 */
public abstract class DriftwoodException extends Exception {

    protected DriftwoodException(String message) {
        super(message);
    }

    protected DriftwoodException(String message, Throwable cause) {
        super(message, cause);
    }
}
