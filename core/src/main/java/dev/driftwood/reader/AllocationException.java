/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

/**
 * Column storage could not be obtained from the {@link dev.driftwood.memory.MemoryPool}.
 */
public class AllocationException extends DriftwoodException {

    public AllocationException(String message) {
        super(message);
    }
}
