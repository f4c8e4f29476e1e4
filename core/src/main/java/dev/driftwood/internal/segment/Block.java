/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.segment;

/**
 * A contiguous range of the input ending at a record boundary (or at the end of the stream).
 *
 * @param index position of this block in the stream, starting at 0
 * @param data the bytes of the block; never split inside a record
 * @param offset byte offset of the block's first byte within the (decompressed) stream
 */
public record Block(long index, byte[] data, long offset) {

    public int size() {
        return data.length;
    }

    @Override
    public String toString() {
        return "Block[index=" + index + ", offset=" + offset + ", size=" + data.length + "]";
    }
}
