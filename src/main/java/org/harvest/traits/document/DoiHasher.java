package org.harvest.traits.document;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives the stable DOI key used to link triples and sentences to literature.
 */
public final class DoiHasher {

    private DoiHasher() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param doi DOI, may be null
     * @return lower-case hex SHA-256 of the trimmed, lower-cased DOI, or null without a DOI
     */
    public static String hash(String doi) {
        if (doi == null || doi.isBlank()) {
            return null;
        }
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            final byte[] hashed = digest.digest(doi.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
