package com.dcruver.ragindex.chunking;

/**
 * Chunker implementations selectable through {@code indexer.chunking.strategy}.
 */
public enum ChunkingStrategy {
    /** Boundary-aware splitting against a token budget */
    RECURSIVE_TOKEN,
    /** Fixed character windows, cut at sentence ends when possible */
    FIXED_SIZE
}
