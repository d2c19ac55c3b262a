package com.dcruver.ragindex.domain;

import lombok.Value;

import java.util.List;

/**
 * Group of units submitted together to the embedding backend.
 * Sequence numbers start at 1 and follow input order.
 */
@Value
public class Batch {
    int sequenceNumber;
    List<FingerprintedUnit> units;
    int estimatedTokens;
    int estimatedChars;

    public List<String> getTexts() {
        return units.stream()
            .map(FingerprintedUnit::getText)
            .toList();
    }

    public int size() {
        return units.size();
    }
}
