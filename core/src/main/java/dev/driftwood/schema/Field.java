/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.schema;

import java.util.Objects;

/**
 * A named, typed field of a {@link Schema} or of a {@link FieldType.StructType}.
 */
public record Field(String name, FieldType type) {

    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public Field withType(FieldType newType) {
        return new Field(name, newType);
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
