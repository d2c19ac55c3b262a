package com.dcruver.ragindex.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A bounded span of one document's text, the item that gets embedded and stored.
 * {@code text} is the trimmed span; the offsets describe the untrimmed span
 * {@code [startOffset, endOffset)} and line numbers are 1-indexed.
 */
@Value
@Builder
public class TextUnit {
    String text;
    String sourcePath;
    int startLine;
    int endLine;
    int startOffset;
    int endOffset;

    /**
     * Identity key used by the store: {@code sourcePath:startLine:endLine}
     */
    public String getIdentityKey() {
        return sourcePath + ":" + startLine + ":" + endLine;
    }

    public int length() {
        return text.length();
    }
}
