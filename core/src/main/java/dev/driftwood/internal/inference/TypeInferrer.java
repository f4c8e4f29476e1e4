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
import java.util.Map;

import dev.driftwood.internal.conversion.TimestampConverter;
import dev.driftwood.internal.parser.JsonValue;
import dev.driftwood.internal.parser.Row;
import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;
import dev.driftwood.schema.Schema;
import dev.driftwood.schema.TimeUnit;

/**
 * Infers the schema of a block of rows.
 * <p>
 * A declared type acts as a template: declared scalar types are kept as they are, even if a value
 * does not match (conversion reports that later), while declared structs, lists and fixed-size lists
 * are descended into so that undeclared nested fields can be added after the declared ones.
 * Undeclared strings holding an ISO-8601 date or second-precision date-time become
 * {@code timestamp[s]}; all other strings are {@code string}.
 * </p>
 */
public final class TypeInferrer {

    private final Schema explicitSchema;
    private final SchemaDraft explicitDraft;

    public TypeInferrer(Schema explicitSchema) {
        this.explicitSchema = explicitSchema;
        this.explicitDraft = SchemaDraft.ofExplicit(explicitSchema);
    }

    /**
     * The draft every block starts from: all explicit fields, even those no row mentions.
     */
    public SchemaDraft explicitDraft() {
        return explicitDraft;
    }

    public SchemaDraft inferBlock(List<Row> rows, long blockIndex) throws TypeConflictException {
        SchemaDraft.Builder builder = new SchemaDraft.Builder(explicitDraft);
        int nextPosition = 0;
        for (Row row : rows) {
            for (Map.Entry<String, JsonValue> member : row.fields().entrySet()) {
                String name = member.getKey();
                Field declared = explicitSchema.contains(name) ? explicitSchema.getField(name) : null;
                try {
                    FieldType observed = infer(member.getValue(), declared == null ? null : declared.type(), name);
                    if (builder.contains(name)) {
                        builder.unify(name, observed);
                    }
                    else {
                        builder.add(new Field(name, observed), FieldOrigin.inferred(blockIndex, nextPosition++));
                    }
                }
                catch (TypeConflictException e) {
                    throw new TypeConflictException(e.getMessage() + " (block " + blockIndex + ", line " + row.line() + ")", e);
                }
            }
        }
        return builder.build();
    }

    /**
     * Infers the type of a single value.
     *
     * @param declared the declared type at this position, or {@code null} if undeclared
     */
    public static FieldType infer(JsonValue value, FieldType declared, String path) throws TypeConflictException {
        if (declared != null) {
            return inferDeclared(value, declared, path);
        }
        if (value instanceof JsonValue.NullValue) {
            return FieldType.NULL;
        }
        if (value instanceof JsonValue.BoolValue) {
            return FieldType.BOOLEAN;
        }
        if (value instanceof JsonValue.IntValue) {
            return FieldType.INT64;
        }
        if (value instanceof JsonValue.FloatValue) {
            return FieldType.FLOAT64;
        }
        if (value instanceof JsonValue.StringValue s) {
            return TimestampConverter.isInferableTimestamp(s.value()) ? FieldType.timestamp(TimeUnit.SECOND) : FieldType.UTF8;
        }
        if (value instanceof JsonValue.ArrayValue array) {
            return FieldType.list(inferElements(array, FieldType.NULL, null, path));
        }
        JsonValue.ObjectValue object = (JsonValue.ObjectValue) value;
        List<Field> fields = new ArrayList<>(object.members().size());
        for (Map.Entry<String, JsonValue> member : object.members().entrySet()) {
            fields.add(new Field(member.getKey(), infer(member.getValue(), null, TypeUnifier.child(path, member.getKey()))));
        }
        return FieldType.struct(fields);
    }

    private static FieldType inferDeclared(JsonValue value, FieldType declared, String path) throws TypeConflictException {
        if (declared instanceof FieldType.StructType struct && value instanceof JsonValue.ObjectValue object) {
            List<Field> fields = new ArrayList<>(struct.fields().size());
            for (Field field : struct.fields()) {
                JsonValue member = object.get(field.name());
                fields.add(member == null ? field
                        : field.withType(infer(member, field.type(), TypeUnifier.child(path, field.name()))));
            }
            for (Map.Entry<String, JsonValue> member : object.members().entrySet()) {
                if (struct.indexOf(member.getKey()) < 0) {
                    fields.add(new Field(member.getKey(), infer(member.getValue(), null, TypeUnifier.child(path, member.getKey()))));
                }
            }
            return FieldType.struct(fields);
        }
        if (declared instanceof FieldType.ListType list && value instanceof JsonValue.ArrayValue array) {
            return FieldType.list(inferElements(array, list.elementType(), list.elementType(), path));
        }
        if (declared instanceof FieldType.FixedSizeListType list && value instanceof JsonValue.ArrayValue array) {
            return FieldType.fixedSizeList(inferElements(array, list.elementType(), list.elementType(), path), list.listSize());
        }
        return declared;
    }

    private static FieldType inferElements(JsonValue.ArrayValue array, FieldType initial, FieldType declaredElement, String path)
            throws TypeConflictException {
        String elementPath = path + "[]";
        FieldType elementType = initial;
        for (JsonValue element : array.elements()) {
            elementType = TypeUnifier.unify(elementType, infer(element, declaredElement, elementPath), elementPath);
        }
        return elementType;
    }
}
