package com.dcruver.ragindex.chunking;

import com.dcruver.ragindex.domain.TextUnit;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Drops units whose trimmed text is shorter than a floor, after chunking.
 */
@Slf4j
public class MinimumSizeFilter implements Chunker {

    private final Chunker delegate;
    private final int minUnitChars;

    public MinimumSizeFilter(Chunker delegate, int minUnitChars) {
        this.delegate = delegate;
        this.minUnitChars = minUnitChars;
    }

    @Override
    public List<TextUnit> chunk(String text, String sourcePath, ChunkingOptions options) {
        List<TextUnit> units = delegate.chunk(text, sourcePath, options);
        List<TextUnit> kept = units.stream()
            .filter(unit -> unit.length() >= minUnitChars)
            .toList();

        if (kept.size() < units.size()) {
            log.debug("Dropped {} units shorter than {} chars from {}",
                units.size() - kept.size(), minUnitChars, sourcePath);
        }
        return kept;
    }
}
