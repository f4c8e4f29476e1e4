/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

/**
 * A record does not fit the shape of the schema: an unexpected field when unexpected fields
 * are rejected, or a fixed-size list value of the wrong length.
 */
public class SchemaException extends DriftwoodException {

    public SchemaException(String message) {
        super(message);
    }
}
