package com.driftops.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable summary of a text corpus: how many messages it held, the retained vocabulary
 * with token counts, and the fingerprint of the feature config
 * used to build it.
 */
public final class DataProfile {

    private final int messageCount;
    private final long totalTokens;
    private final Map<String, Long> termCounts;
    private final String featureFingerprint;
    private final Instant builtAt;

    public DataProfile(int messageCount, Map<String, Long> termCounts,
                       String featureFingerprint, Instant builtAt) {
        this.messageCount = messageCount;
        this.termCounts = Collections.unmodifiableMap(new LinkedHashMap<>(termCounts));
        this.totalTokens = termCounts.values().stream().mapToLong(Long::longValue).sum();
        this.featureFingerprint = featureFingerprint;
        this.builtAt = builtAt;
    }

    public int messageCount() {
        return messageCount;
    }

    public long totalTokens() {
        return totalTokens;
    }

    /** Retained terms ordered by count descending. */
    public Map<String, Long> termCounts() {
        return termCounts;
    }

    public Set<String> vocabulary() {
        return termCounts.keySet();
    }

    public long count(String term) {
        return termCounts.getOrDefault(term, 0L);
    }

    public double relativeFrequency(String term) {
        return totalTokens == 0 ? 0.0 : (double) count(term) / totalTokens;
    }

    public String featureFingerprint() {
        return featureFingerprint;
    }

    public Instant builtAt() {
        return builtAt;
    }

    public boolean isEmpty() {
        return messageCount == 0;
    }
}
