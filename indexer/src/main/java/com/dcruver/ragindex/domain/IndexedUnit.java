package com.dcruver.ragindex.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A unit together with its fingerprint and embedding, ready to be persisted.
 */
@Value
@Builder
public class IndexedUnit {
    String id;
    String text;
    String sourcePath;
    int startLine;
    int endLine;
    int startOffset;
    int endOffset;
    String fingerprint;
    float[] vector;

    public static IndexedUnit of(FingerprintedUnit fingerprinted, float[] vector) {
        TextUnit unit = fingerprinted.getUnit();
        return IndexedUnit.builder()
            .id(unit.getIdentityKey())
            .text(unit.getText())
            .sourcePath(unit.getSourcePath())
            .startLine(unit.getStartLine())
            .endLine(unit.getEndLine())
            .startOffset(unit.getStartOffset())
            .endOffset(unit.getEndOffset())
            .fingerprint(fingerprinted.getFingerprint())
            .vector(vector)
            .build();
    }
}
