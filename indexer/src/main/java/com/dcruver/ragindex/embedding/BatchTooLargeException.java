package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.domain.IndexingException;
import com.dcruver.ragindex.domain.TextUnit;
import lombok.Getter;

/**
 * A single unit exceeds the per-batch character or token limit on its own.
 */
@Getter
public class BatchTooLargeException extends IndexingException {

    private final TextUnit unit;

    public BatchTooLargeException(TextUnit unit, int chars, int tokens, BatchLimits limits) {
        super(String.format(
            "Unit %s (%d chars, ~%d tokens) exceeds batch limits (%d chars, %d tokens)",
            unit.getIdentityKey(), chars, tokens, limits.getMaxChars(), limits.getMaxTokens()));
        this.unit = unit;
    }
}
