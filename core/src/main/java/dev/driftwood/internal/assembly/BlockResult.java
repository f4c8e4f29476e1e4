/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.assembly;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.driftwood.column.ColumnVector;
import dev.driftwood.internal.inference.SchemaDraft;
import dev.driftwood.memory.MemoryAccount;

/**
 * The outcome of processing one block: its locally inferred schema and one column segment per
 * field of that schema, typed with the block-local type. Storage is charged to {@code account}
 * until the table assembler takes it over.
 */
public record BlockResult(long blockIndex, SchemaDraft draft, Map<String, ColumnVector> columns, int rowCount,
                          MemoryAccount account) {

    public BlockResult {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public ColumnVector column(String name) {
        return columns.get(name);
    }

    public long allocatedBytes() {
        return account.bytes();
    }
}
