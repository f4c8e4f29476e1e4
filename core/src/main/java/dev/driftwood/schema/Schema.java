/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.schema;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered, name-unique list of top-level fields.
 * <p>
 * Used both for the explicit schema a caller declares and for the unified schema of a
 * {@link dev.driftwood.column.Table}.
 * </p>
 */
public final class Schema {

    private static final Schema EMPTY = new Schema(List.of());

    private final List<Field> fields;
    private final FieldNameIndex nameIndex;

    private Schema(List<Field> fields) {
        this.fields = List.copyOf(fields);
        this.nameIndex = FieldNameIndex.of(this.fields, "schema");
    }

    public static Schema of(Field... fields) {
        return new Schema(Arrays.asList(fields));
    }

    public static Schema of(List<Field> fields) {
        return fields.isEmpty() ? EMPTY : new Schema(fields);
    }

    public static Schema empty() {
        return EMPTY;
    }

    public List<Field> getFields() {
        return fields;
    }

    public Field getField(int index) {
        return fields.get(index);
    }

    public Field getField(String name) {
        int index = nameIndex.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Field not found: " + name);
        }
        return fields.get(index);
    }

    /**
     * Returns the position of the named field, or -1 if absent.
     */
    public int indexOf(String name) {
        return nameIndex.indexOf(name);
    }

    public boolean contains(String name) {
        return nameIndex.indexOf(name) >= 0;
    }

    public int getFieldCount() {
        return fields.size();
    }

    /**
     * Views this schema as a struct type, the shape of a single record.
     */
    public FieldType.StructType asStruct() {
        return new FieldType.StructType(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Schema other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Field field : fields) {
            sb.append(field).append(";\n");
        }
        return sb.toString();
    }
}
