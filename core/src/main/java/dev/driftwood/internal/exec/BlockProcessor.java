/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.exec;

import java.util.List;

import dev.driftwood.internal.assembly.BlockResult;
import dev.driftwood.internal.assembly.ColumnAssembler;
import dev.driftwood.internal.inference.SchemaDraft;
import dev.driftwood.internal.inference.TypeInferrer;
import dev.driftwood.internal.parser.Row;
import dev.driftwood.internal.parser.RowParser;
import dev.driftwood.internal.segment.Block;
import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.memory.MemoryPool;
import dev.driftwood.reader.DriftwoodException;
import dev.driftwood.reader.ParseOptions;

/**
 * Runs the per-block pipeline: parse, infer, assemble. Instances are stateless apart from their
 * configuration and may process several blocks concurrently.
 */
public final class BlockProcessor {

    private final RowParser parser;
    private final TypeInferrer inferrer;
    private final MemoryPool pool;

    public BlockProcessor(ParseOptions options, MemoryPool pool) {
        this.parser = new RowParser(options);
        this.inferrer = new TypeInferrer(options.explicitSchemaOrEmpty());
        this.pool = pool;
    }

    /**
     * The draft blocks are merged into, holding the explicitly declared fields.
     */
    public SchemaDraft initialDraft() {
        return inferrer.explicitDraft();
    }

    public MemoryPool pool() {
        return pool;
    }

    /**
     * Processes one block. On failure, any memory reserved for it has been released.
     */
    public BlockResult process(Block block) throws DriftwoodException {
        BlockProcessedEvent event = new BlockProcessedEvent();
        event.begin();

        MemoryAccount account = new MemoryAccount(pool);
        try {
            List<Row> rows = parser.parse(block);
            SchemaDraft draft = inferrer.inferBlock(rows, block.index());
            BlockResult result = ColumnAssembler.assemble(block, rows, draft, account);

            event.blockIndex = block.index();
            event.blockSize = block.size();
            event.rows = result.rowCount();
            event.fields = draft.size();
            event.allocatedBytes = result.allocatedBytes();
            event.commit();
            return result;
        }
        catch (DriftwoodException | RuntimeException e) {
            account.releaseAll();
            throw e;
        }
    }
}
