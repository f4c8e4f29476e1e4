/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.compression;

import java.io.InputStream;

/**
 * Pass-through for uncompressed input.
 */
public class UncompressedStreamDecompressor implements StreamDecompressor {

    @Override
    public InputStream wrap(InputStream compressed) {
        return compressed;
    }

    @Override
    public String getName() {
        return "NONE";
    }
}
