package com.dcruver.ragindex.chunking;

import com.dcruver.ragindex.domain.TextUnit;

import java.util.List;

/**
 * Splits one document into an ordered sequence of bounded, possibly overlapping units.
 * Empty or whitespace-only text yields an empty list.
 */
public interface Chunker {

    List<TextUnit> chunk(String text, String sourcePath, ChunkingOptions options);
}
