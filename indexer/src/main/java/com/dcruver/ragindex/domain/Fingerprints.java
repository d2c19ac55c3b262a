package com.dcruver.ragindex.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content hash of a unit's trimmed text, used as the deduplication key.
 * SHA-256 is used for its low collision probability, not for security.
 */
public final class Fingerprints {

    private static final String ALGORITHM = "SHA-256";

    private Fingerprints() {
    }

    public static String of(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] hash = digest.digest(text.strip().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
