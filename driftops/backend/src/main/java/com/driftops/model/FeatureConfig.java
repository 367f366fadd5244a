package com.driftops.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Feature extraction settings a {@link DataProfile} was built with. Two profiles are only
 * comparable when their configs share the same {@link #fingerprint()}.
 */
public record FeatureConfig(
    String tokenPattern,
    boolean lowercase,
    Set<String> stopwords,
    int maxVocabularySize,
    int minTokenLength
) {

    public FeatureConfig {
        if (tokenPattern == null || tokenPattern.isBlank()) {
            throw new IllegalArgumentException("tokenPattern must not be blank");
        }
        if (maxVocabularySize < 1) {
            throw new IllegalArgumentException("maxVocabularySize must be positive");
        }
        Pattern.compile(tokenPattern);
        stopwords = stopwords == null ? Set.of() : Set.copyOf(stopwords);
        minTokenLength = Math.max(1, minTokenLength);
    }

    public String fingerprint() {
        String canonical = tokenPattern + '\u0000' + lowercase + '\u0000'
            + String.join(",", new TreeSet<>(stopwords)) + '\u0000'
            + maxVocabularySize + '\u0000' + minTokenLength;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
