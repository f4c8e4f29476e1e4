/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.compression;

import java.io.IOException;
import java.io.InputStream;

import org.xerial.snappy.SnappyFramedInputStream;

/**
 * Decompressor for the Snappy framing format ({@code .sz} files).
 */
public class SnappyStreamDecompressor implements StreamDecompressor {

    @Override
    public InputStream wrap(InputStream compressed) throws IOException {
        return new SnappyFramedInputStream(compressed);
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
