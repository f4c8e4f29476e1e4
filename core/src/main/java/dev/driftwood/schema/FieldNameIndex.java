/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.schema;

import java.util.List;

/**
 * Open-addressed hash map with linear probing from field name to field position.
 * Built once per schema or struct type and read-only afterwards.
 */
final class FieldNameIndex {

    private static final int ABSENT = -1;

    private final String[] names;
    private final int[] positions;
    private final int mask;

    private FieldNameIndex(int expectedSize) {
        // ~66% load factor, power-of-2 table
        int capacity = tableSizeFor(expectedSize + (expectedSize >> 1) + 1);
        this.names = new String[capacity];
        this.positions = new int[capacity];
        this.mask = capacity - 1;
    }

    /**
     * Indexes the given fields, rejecting duplicate names.
     *
     * @param owner description of the schema or struct, used in the error message
     */
    static FieldNameIndex of(List<Field> fields, String owner) {
        FieldNameIndex index = new FieldNameIndex(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            String name = fields.get(i).name();
            int existing = index.putIfAbsent(name, i);
            if (existing != ABSENT) {
                throw new IllegalArgumentException("Duplicate field name '" + name + "' in " + owner
                        + " (positions " + existing + " and " + i + ")");
            }
        }
        return index;
    }

    private int putIfAbsent(String name, int position) {
        int slot = name.hashCode() & mask;
        while (names[slot] != null) {
            if (names[slot].equals(name)) {
                return positions[slot];
            }
            slot = (slot + 1) & mask;
        }
        names[slot] = name;
        positions[slot] = position;
        return ABSENT;
    }

    /**
     * Position of the named field, or -1 if there is none.
     */
    int indexOf(String name) {
        int slot = name.hashCode() & mask;
        while (names[slot] != null) {
            if (names[slot].equals(name)) {
                return positions[slot];
            }
            slot = (slot + 1) & mask;
        }
        return ABSENT;
    }

    private static int tableSizeFor(int cap) {
        int n = cap - 1;
        n |= n >>> 1;
        n |= n >>> 2;
        n |= n >>> 4;
        n |= n >>> 8;
        n |= n >>> 16;
        return (n < 8) ? 8 : (n >= 1 << 30) ? 1 << 30 : n + 1;
    }
}
