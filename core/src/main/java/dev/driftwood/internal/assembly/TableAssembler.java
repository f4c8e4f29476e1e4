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

import dev.driftwood.column.ChunkedColumn;
import dev.driftwood.column.ColumnVector;
import dev.driftwood.column.Table;
import dev.driftwood.internal.inference.SchemaDraft;
import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.reader.AllocationException;
import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.Schema;

/**
 * Combines per-block results into a {@link Table}.
 * <p>
 * Block drafts are merged in block order, starting from the explicit fields, which yields the final
 * schema. Each block then contributes exactly one chunk per column: its own segment promoted to the
 * unified type, or an all-null segment if the block never saw the field.
 * </p>
 */
public final class TableAssembler {

    private static final System.Logger LOG = System.getLogger(TableAssembler.class.getName());

    private TableAssembler() {
    }

    public static Schema unifySchema(SchemaDraft initial, List<BlockResult> results) throws TypeConflictException {
        SchemaDraft unified = initial;
        for (BlockResult result : results) {
            unified = unified.merge(result.draft(), "block " + result.blockIndex());
        }
        return unified.toSchema();
    }

    /**
     * Builds the table, moving the storage of all blocks onto {@code account}. On failure the
     * block accounts are left untouched for the caller to release.
     */
    public static Table assemble(SchemaDraft initial, List<BlockResult> results, MemoryAccount account)
            throws TypeConflictException, AllocationException {
        Schema schema = unifySchema(initial, results);

        long rowCount = 0;
        for (BlockResult result : results) {
            rowCount += result.rowCount();
        }

        List<ChunkedColumn> columns = new ArrayList<>(schema.getFieldCount());
        for (Field field : schema.getFields()) {
            List<ColumnVector> chunks = new ArrayList<>(results.size());
            for (BlockResult result : results) {
                ColumnVector segment = result.column(field.name());
                chunks.add(segment == null
                        ? ColumnPromoter.nulls(field.type(), result.rowCount(), account, field.name())
                        : ColumnPromoter.promote(segment, field.type(), account, field.name()));
            }
            columns.add(new ChunkedColumn(field, chunks));
        }

        for (BlockResult result : results) {
            result.account().transferTo(account);
        }
        LOG.log(System.Logger.Level.DEBUG, "Assembled table with {0} rows, {1} columns and {2} chunks per column",
                rowCount, schema.getFieldCount(), results.size());
        return new Table(schema, columns, rowCount, account);
    }
}
