/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.assembly;

import java.util.ArrayList;
import java.util.List;

import dev.driftwood.column.ColumnVector;
import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.reader.AllocationException;
import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;

/**
 * Rewrites a column segment built with a block-local type into the unified type of the table.
 * <p>
 * Supported promotions mirror type unification: a {@code null} segment becomes an all-null segment
 * of the target type, {@code int64} and {@code float} widen to {@code double}, list children are promoted recursively,
 * and struct segments are reordered into the target's field order with missing children filled with
 * nulls. Segments already of the target type are returned as is.
 * </p>
 */
public final class ColumnPromoter {

    private ColumnPromoter() {
    }

    public static ColumnVector promote(ColumnVector segment, FieldType target, MemoryAccount account, String path)
            throws TypeConflictException, AllocationException {
        if (segment.type().equals(target)) {
            return segment;
        }
        if (segment instanceof ColumnVector.NullVector) {
            return nulls(target, segment.length(), account, path);
        }
        if (segment instanceof ColumnVector.Int64Vector ints && target instanceof FieldType.Float64Type) {
            account.allocate((long) ints.length() * Double.BYTES);
            double[] values = new double[ints.length()];
            for (int i = 0; i < values.length; i++) {
                values[i] = ints.values()[i];
            }
            return new ColumnVector.Float64Vector(values, ints.nulls(), ints.length());
        }
        if (segment instanceof ColumnVector.Float32Vector floats && target instanceof FieldType.Float64Type) {
            account.allocate((long) floats.length() * Double.BYTES);
            double[] values = new double[floats.length()];
            for (int i = 0; i < values.length; i++) {
                values[i] = floats.values()[i];
            }
            return new ColumnVector.Float64Vector(values, floats.nulls(), floats.length());
        }
        if (segment instanceof ColumnVector.ListVector list && target instanceof FieldType.ListType listType) {
            ColumnVector values = promote(list.values(), listType.elementType(), account, path + "[]");
            return new ColumnVector.ListVector(listType, list.offsets(), values, list.nulls(), list.length());
        }
        if (segment instanceof ColumnVector.FixedSizeListVector list && target instanceof FieldType.FixedSizeListType listType
                && list.type().listSize() == listType.listSize()) {
            ColumnVector values = promote(list.values(), listType.elementType(), account, path + "[]");
            return new ColumnVector.FixedSizeListVector(listType, values, list.nulls(), list.length());
        }
        if (segment instanceof ColumnVector.StructVector struct && target instanceof FieldType.StructType structType) {
            return promoteStruct(struct, structType, account, path);
        }
        throw new TypeConflictException("Field '" + path + "': cannot convert a " + segment.type()
                + " column segment to " + target);
    }

    /**
     * An all-null segment of the given type and length.
     */
    public static ColumnVector nulls(FieldType type, int length, MemoryAccount account, String path)
            throws AllocationException {
        if (type instanceof FieldType.NullType) {
            return new ColumnVector.NullVector(length);
        }
        ColumnBuilder builder = ColumnBuilder.create(type, path, account);
        for (int i = 0; i < length; i++) {
            builder.appendNull();
        }
        return builder.build();
    }

    private static ColumnVector promoteStruct(ColumnVector.StructVector struct, FieldType.StructType target,
                                              MemoryAccount account, String path)
            throws TypeConflictException, AllocationException {
        for (Field field : struct.type().fields()) {
            if (target.indexOf(field.name()) < 0) {
                throw new TypeConflictException("Field '" + path + "': " + target + " has no field '" + field.name() + "'");
            }
        }
        List<ColumnVector> children = new ArrayList<>(target.fields().size());
        for (Field field : target.fields()) {
            String childPath = path.isEmpty() ? field.name() : path + "." + field.name();
            int index = struct.type().indexOf(field.name());
            children.add(index < 0
                    ? nulls(field.type(), struct.length(), account, childPath)
                    : promote(struct.child(index), field.type(), account, childPath));
        }
        return new ColumnVector.StructVector(target, children, struct.nulls(), struct.length());
    }
}
