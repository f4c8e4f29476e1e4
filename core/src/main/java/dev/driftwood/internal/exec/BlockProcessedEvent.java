/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.exec;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted for each block that was parsed, typed and converted into column segments.
 * The event duration covers the whole block pipeline.
 */
@Name("dev.driftwood.BlockProcessed")
@Label("Block Processed")
@Category({"Driftwood", "Pipeline"})
@Description("Parsing, inference and column assembly of one block of JSON lines")
public class BlockProcessedEvent extends Event {

    @Label("Block Index")
    @Description("Zero-based index of the block in the input")
    public long blockIndex;

    @Label("Block Size")
    @Description("Size of the block (bytes)")
    public long blockSize;

    @Label("Rows")
    @Description("Number of records in the block")
    public int rows;

    @Label("Fields")
    @Description("Number of top-level fields in the block's inferred schema")
    public int fields;

    @Label("Allocated")
    @Description("Bytes reserved from the memory pool for the block's columns")
    public long allocatedBytes;
}
