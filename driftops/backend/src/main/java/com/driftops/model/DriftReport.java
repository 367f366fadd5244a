package com.driftops.model;

import java.time.Instant;
import java.util.List;

/**
 * Result of comparing a sample profile against the reference profile, with the thresholds
 * it was judged against. {@code driftDetected} is derived from the scores and thresholds,
 * never stored separately.
 */
public record DriftReport(
    double vocabularyDrift,
    double distributionDrift,
    List<String> emergentTerms,
    double vocabularyThreshold,
    double distributionThreshold,
    double alertVocabularyThreshold,
    double alertDistributionThreshold,
    int referenceMessages,
    int sampleMessages,
    Instant computedAt
) {

    public DriftReport {
        emergentTerms = emergentTerms == null ? List.of() : List.copyOf(emergentTerms);
    }

    public boolean driftDetected() {
        return vocabularyDrift > vocabularyThreshold || distributionDrift > distributionThreshold;
    }

    public boolean vocabularyDriftDetected() {
        return vocabularyDrift > vocabularyThreshold;
    }

    public boolean distributionDriftDetected() {
        return distributionDrift > distributionThreshold;
    }

    public boolean vocabularyDriftElevated() {
        return vocabularyDrift > alertVocabularyThreshold;
    }

    public boolean distributionDriftElevated() {
        return distributionDrift > alertDistributionThreshold;
    }
}
