/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;
import dev.driftwood.schema.Schema;

/**
 * An immutable, partially inferred schema: the top-level fields seen so far, each with its current
 * type and the {@link FieldOrigin} deciding its column position.
 */
public final class SchemaDraft {

    private static final SchemaDraft EMPTY = new SchemaDraft(List.of());

    public record Entry(Field field, FieldOrigin origin) {

        public String name() {
            return field.name();
        }

        public FieldType type() {
            return field.type();
        }
    }

    private final List<Entry> entries;
    private final Map<String, Integer> positions;

    private SchemaDraft(List<Entry> entries) {
        this.entries = entries;
        this.positions = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            positions.put(entries.get(i).name(), i);
        }
    }

    public static SchemaDraft empty() {
        return EMPTY;
    }

    /**
     * A draft holding just the explicitly declared fields, in declaration order.
     */
    public static SchemaDraft ofExplicit(Schema explicit) {
        Builder builder = new Builder();
        List<Field> fields = explicit.getFields();
        for (int i = 0; i < fields.size(); i++) {
            builder.add(fields.get(i), FieldOrigin.explicit(i));
        }
        return builder.build();
    }

    public List<Entry> entries() {
        return entries;
    }

    public Entry entry(String name) {
        Integer position = positions.get(name);
        return position == null ? null : entries.get(position);
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Unifies this draft with a later one. Fields present in both are unified and keep the earlier
     * origin; fields only {@code other} has are added with their own origin.
     *
     * @param context describes {@code other} in error messages, e.g. {@code "block 3"}
     */
    public SchemaDraft merge(SchemaDraft other, String context) throws TypeConflictException {
        Builder builder = new Builder(this);
        for (Entry entry : other.entries) {
            try {
                builder.addOrUnify(entry.field(), entry.origin());
            }
            catch (TypeConflictException e) {
                throw new TypeConflictException(e.getMessage() + " (merging " + context + ")", e);
            }
        }
        return builder.build();
    }

    public Schema toSchema() {
        List<Field> fields = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            fields.add(entry.field());
        }
        return Schema.of(fields);
    }

    @Override
    public String toString() {
        return "SchemaDraft" + entries;
    }

    /**
     * Collects entries in any order; {@link #build()} orders them by origin.
     */
    public static final class Builder {

        private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

        public Builder() {
        }

        public Builder(SchemaDraft draft) {
            for (Entry entry : draft.entries) {
                entries.put(entry.name(), entry);
            }
        }

        public boolean contains(String name) {
            return entries.containsKey(name);
        }

        public Builder add(Field field, FieldOrigin origin) {
            if (entries.putIfAbsent(field.name(), new Entry(field, origin)) != null) {
                throw new IllegalArgumentException("Duplicate field '" + field.name() + "'");
            }
            return this;
        }

        /**
         * Adds the field, or unifies its type into the existing entry of the same name while keeping
         * whichever origin sorts first.
         */
        public Builder addOrUnify(Field field, FieldOrigin origin) throws TypeConflictException {
            Entry existing = entries.get(field.name());
            if (existing == null) {
                entries.put(field.name(), new Entry(field, origin));
                return this;
            }
            FieldType unified = TypeUnifier.unify(existing.type(), field.type(), field.name());
            FieldOrigin first = existing.origin().compareTo(origin) <= 0 ? existing.origin() : origin;
            entries.put(field.name(), new Entry(existing.field().withType(unified), first));
            return this;
        }

        /**
         * Unifies a type into an entry that must already exist, keeping its origin.
         */
        public Builder unify(String name, FieldType type) throws TypeConflictException {
            Entry existing = entries.get(name);
            if (existing == null) {
                throw new IllegalArgumentException("Unknown field '" + name + "'");
            }
            entries.put(name, new Entry(existing.field().withType(TypeUnifier.unify(existing.type(), type, name)), existing.origin()));
            return this;
        }

        public SchemaDraft build() {
            List<Entry> sorted = new ArrayList<>(entries.values());
            sorted.sort(Comparator.comparing(Entry::origin));
            return sorted.isEmpty() ? EMPTY : new SchemaDraft(Collections.unmodifiableList(sorted));
        }
    }
}
