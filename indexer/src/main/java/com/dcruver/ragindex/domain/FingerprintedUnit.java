package com.dcruver.ragindex.domain;

import lombok.Value;

/**
 * A unit that passed deduplication, paired with its fingerprint.
 */
@Value
public class FingerprintedUnit {
    TextUnit unit;
    String fingerprint;

    public static FingerprintedUnit of(TextUnit unit) {
        return new FingerprintedUnit(unit, Fingerprints.of(unit.getText()));
    }

    public String getText() {
        return unit.getText();
    }
}
