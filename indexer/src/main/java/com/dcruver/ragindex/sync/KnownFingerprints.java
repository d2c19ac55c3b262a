package com.dcruver.ragindex.sync;

import java.util.HashSet;
import java.util.Set;

/**
 * Fingerprints already present in the store or accepted earlier in the same run.
 * Owned by a single run and passed explicitly; not thread-safe.
 */
public class KnownFingerprints {

    private final Set<String> fingerprints;

    private KnownFingerprints(Set<String> fingerprints) {
        this.fingerprints = fingerprints;
    }

    public static KnownFingerprints seededWith(Set<String> persisted) {
        return new KnownFingerprints(new HashSet<>(persisted));
    }

    public static KnownFingerprints empty() {
        return new KnownFingerprints(new HashSet<>());
    }

    /**
     * Record a fingerprint. Returns false when it was already known.
     */
    public boolean accept(String fingerprint) {
        return fingerprints.add(fingerprint);
    }

    public boolean contains(String fingerprint) {
        return fingerprints.contains(fingerprint);
    }

    public int size() {
        return fingerprints.size();
    }
}
