/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

/**
 * A line is not valid JSON, or its top-level value is not an object.
 */
public class RecordParseException extends DriftwoodException {

    public RecordParseException(String message) {
        super(message);
    }

    public RecordParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
