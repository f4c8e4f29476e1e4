/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.inference;

/**
 * Where a top-level field was first seen, which determines its position in the final schema.
 * Explicit fields come first in declaration order, followed by inferred fields ordered by the
 * block and the position within that block at which they first appeared.
 */
public record FieldOrigin(boolean explicit, long blockIndex, int position) implements Comparable<FieldOrigin> {

    public static FieldOrigin explicit(int position) {
        return new FieldOrigin(true, -1, position);
    }

    public static FieldOrigin inferred(long blockIndex, int position) {
        return new FieldOrigin(false, blockIndex, position);
    }

    @Override
    public int compareTo(FieldOrigin other) {
        if (explicit != other.explicit) {
            return explicit ? -1 : 1;
        }
        int byBlock = Long.compare(blockIndex, other.blockIndex);
        return byBlock != 0 ? byBlock : Integer.compare(position, other.position);
    }
}
