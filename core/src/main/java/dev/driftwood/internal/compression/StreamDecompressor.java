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

/**
 * Wraps a compressed input stream into a stream of the uncompressed bytes.
 */
public interface StreamDecompressor {

    /**
     * @param compressed the compressed stream; closing the returned stream closes it
     * @throws IOException if the stream header is invalid or cannot be read
     */
    InputStream wrap(InputStream compressed) throws IOException;

    /**
     * Get the name of this decompressor.
     */
    String getName();
}
