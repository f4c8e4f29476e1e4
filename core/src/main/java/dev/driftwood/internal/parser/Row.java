/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.parser;

import java.util.Map;

/**
 * One parsed record.
 *
 * @param blockIndex index of the block the record came from
 * @param position position of the record among the block's records, starting at 0
 * @param line line number within the block, starting at 1; blank lines are counted
 * @param value the record's fields in input order
 */
public record Row(long blockIndex, int position, int line, JsonValue.ObjectValue value) {

    public Map<String, JsonValue> fields() {
        return value.members();
    }

    /**
     * The field's value, or null if the record does not contain the field.
     */
    public JsonValue get(String name) {
        return value.get(name);
    }
}
