/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.assembly;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.driftwood.column.ColumnVector;
import dev.driftwood.internal.inference.SchemaDraft;
import dev.driftwood.internal.parser.Row;
import dev.driftwood.internal.segment.Block;
import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.reader.AllocationException;
import dev.driftwood.reader.SchemaException;
import dev.driftwood.reader.TypeConflictException;

/**
 * Converts the parsed rows of a block into one column segment per field of the block's schema draft.
 */
public final class ColumnAssembler {

    private ColumnAssembler() {
    }

    public static BlockResult assemble(Block block, List<Row> rows, SchemaDraft draft, MemoryAccount account)
            throws TypeConflictException, SchemaException, AllocationException {
        List<SchemaDraft.Entry> entries = draft.entries();
        List<ColumnBuilder> builders = new ArrayList<>(entries.size());
        for (SchemaDraft.Entry entry : entries) {
            builders.add(ColumnBuilder.create(entry.type(), entry.name(), account));
        }

        for (int f = 0; f < entries.size(); f++) {
            String name = entries.get(f).name();
            ColumnBuilder builder = builders.get(f);
            for (Row row : rows) {
                try {
                    builder.append(row.get(name));
                }
                catch (TypeConflictException e) {
                    throw new TypeConflictException(e.getMessage() + " (" + location(block, row) + ")", e);
                }
                catch (SchemaException e) {
                    throw new SchemaException(e.getMessage() + " (" + location(block, row) + ")");
                }
            }
        }

        Map<String, ColumnVector> columns = new LinkedHashMap<>();
        for (int f = 0; f < entries.size(); f++) {
            columns.put(entries.get(f).name(), builders.get(f).build());
        }
        return new BlockResult(block.index(), draft, columns, rows.size(), account);
    }

    private static String location(Block block, Row row) {
        return "block " + block.index() + ", line " + row.line();
    }
}
