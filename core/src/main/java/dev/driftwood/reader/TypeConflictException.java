/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

/**
 * Two observed types of a field cannot be unified, or a value cannot be converted losslessly
 * into the type an explicit schema declares.
 */
public class TypeConflictException extends DriftwoodException {

    public TypeConflictException(String message) {
        super(message);
    }

    public TypeConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
