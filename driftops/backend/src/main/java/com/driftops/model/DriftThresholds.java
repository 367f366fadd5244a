package com.driftops.model;

/**
 * Retrain thresholds plus the lower alert thresholds used by the rule-based policy.
 */
public record DriftThresholds(
    double vocabulary,
    double distribution,
    double alertVocabulary,
    double alertDistribution
) {

    public DriftThresholds {
        checkUnit("vocabulary", vocabulary);
        checkUnit("distribution", distribution);
        checkUnit("alertVocabulary", alertVocabulary);
        checkUnit("alertDistribution", alertDistribution);
        if (alertVocabulary > vocabulary || alertDistribution > distribution) {
            throw new IllegalArgumentException("alert thresholds must not exceed retrain thresholds");
        }
    }

    private static void checkUnit(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " threshold must be within [0,1]: " + value);
        }
    }
}
