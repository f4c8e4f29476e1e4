/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

/**
 * How to treat a field that the explicit schema does not declare.
 */
public enum UnexpectedFieldBehavior {

    /** Drop the field silently. */
    IGNORE,

    /** Fail the read with a {@link SchemaException}. */
    ERROR,

    /** Keep the field and infer its type from the data. */
    INFER_TYPE
}
