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
import java.util.zip.GZIPInputStream;

/**
 * Decompressor for GZIP streams using the JDK's {@link GZIPInputStream}.
 * Concatenated GZIP members are read as a single stream.
 */
public class GzipStreamDecompressor implements StreamDecompressor {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public InputStream wrap(InputStream compressed) throws IOException {
        return new GZIPInputStream(compressed, BUFFER_SIZE);
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
