package com.dcruver.ragindex.chunking;

import com.dcruver.ragindex.config.ConfigurationException;

/**
 * Builds the configured chunker, wrapped with the minimum-size filter when one is set.
 */
public final class ChunkerFactory {

    private ChunkerFactory() {
    }

    public static Chunker create(ChunkingStrategy strategy, int minUnitChars) {
        if (strategy == null) {
            throw new ConfigurationException("Chunking strategy must be set");
        }
        if (minUnitChars < 0) {
            throw new ConfigurationException("Minimum unit size must be non-negative, got " + minUnitChars);
        }

        Chunker chunker = switch (strategy) {
            case RECURSIVE_TOKEN -> new RecursiveTokenChunker();
            case FIXED_SIZE -> new FixedSizeChunker();
        };

        return minUnitChars > 0 ? new MinimumSizeFilter(chunker, minUnitChars) : chunker;
    }
}
