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
import jdk.jfr.StackTrace;

/**
 * JFR event emitted when the reading thread blocks because the maximum number of blocks is
 * already being processed.
 * <p>
 * Frequent long waits indicate that processing, not input, is the bottleneck.
 * </p>
 */
@Name("dev.driftwood.BlockWait")
@Label("Block Wait")
@Category({"Driftwood", "Pipeline"})
@Description("Reader blocked waiting for a processing slot to become free")
@StackTrace(false)
public class BlockWaitEvent extends Event {

    @Label("Block Index")
    @Description("Index of the block waiting to be submitted")
    public long blockIndex;

    @Label("Wait Duration (ms)")
    @Description("Time spent waiting for a free slot (milliseconds)")
    public long waitDurationMs;
}
