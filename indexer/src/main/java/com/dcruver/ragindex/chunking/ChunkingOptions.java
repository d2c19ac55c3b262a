package com.dcruver.ragindex.chunking;

import com.dcruver.ragindex.config.ConfigurationException;
import lombok.Value;

/**
 * Target unit size and overlap. Tokens for the recursive chunker,
 * characters for the fixed-size chunker.
 */
@Value
public class ChunkingOptions {
    int size;
    int overlap;

    public ChunkingOptions(int size, int overlap) {
        if (size <= 0) {
            throw new ConfigurationException("Chunk size must be greater than 0, got " + size);
        }
        if (overlap < 0) {
            throw new ConfigurationException("Chunk overlap must be non-negative, got " + overlap);
        }
        if (overlap >= size) {
            throw new ConfigurationException(
                "Chunk overlap (" + overlap + ") must be less than chunk size (" + size + ")");
        }
        this.size = size;
        this.overlap = overlap;
    }
}
