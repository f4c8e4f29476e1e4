/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.inference;

import java.util.ArrayList;
import java.util.List;

import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;

/**
 * Computes the least common type of two field types.
 * <p>
 * {@code null} unifies with anything, two different numeric types unify to {@code double},
 * lists unify element-wise and structs unify field by field, keeping the left side's order and
 * appending fields only the right side has. Everything else is a conflict.
 * </p>
 */
public final class TypeUnifier {

    private TypeUnifier() {
    }

    public static FieldType unify(FieldType left, FieldType right) throws TypeConflictException {
        return unify(left, right, "");
    }

    /**
     * @param path dotted path of the field being unified, used in error messages
     */
    public static FieldType unify(FieldType left, FieldType right, String path) throws TypeConflictException {
        if (left instanceof FieldType.NullType) {
            return right;
        }
        if (right instanceof FieldType.NullType || left.equals(right)) {
            return left;
        }
        if (isNumeric(left) && isNumeric(right)) {
            return FieldType.FLOAT64;
        }
        if (left instanceof FieldType.ListType l && right instanceof FieldType.ListType r) {
            return FieldType.list(unify(l.elementType(), r.elementType(), path + "[]"));
        }
        if (left instanceof FieldType.FixedSizeListType l && right instanceof FieldType.FixedSizeListType r
                && l.listSize() == r.listSize()) {
            return FieldType.fixedSizeList(unify(l.elementType(), r.elementType(), path + "[]"), l.listSize());
        }
        if (left instanceof FieldType.StructType l && right instanceof FieldType.StructType r) {
            return unifyStructs(l, r, path);
        }
        throw new TypeConflictException("Field '" + display(path) + "': cannot unify " + left + " with " + right);
    }

    private static FieldType.StructType unifyStructs(FieldType.StructType left, FieldType.StructType right, String path)
            throws TypeConflictException {
        List<Field> merged = new ArrayList<>(left.fields().size() + right.fields().size());
        for (Field field : left.fields()) {
            Field other = right.field(field.name());
            merged.add(other == null ? field : field.withType(unify(field.type(), other.type(), child(path, field.name()))));
        }
        for (Field field : right.fields()) {
            if (left.indexOf(field.name()) < 0) {
                merged.add(field);
            }
        }
        return FieldType.struct(merged);
    }

    private static boolean isNumeric(FieldType type) {
        return type instanceof FieldType.Int64Type || type instanceof FieldType.Float32Type
                || type instanceof FieldType.Float64Type;
    }

    static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private static String display(String path) {
        return path.isEmpty() ? "<root>" : path;
    }
}
