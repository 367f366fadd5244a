package com.driftops.config;

import com.driftops.model.DriftThresholds;
import com.driftops.model.FeatureConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "mlops.drift")
public class DriftProperties {

    /** Retrain trigger thresholds; a sub-score strictly above its threshold is drift. */
    private double vocabularyThreshold = 0.15;
    private double distributionThreshold = 0.10;

    /** Secondary thresholds: above these (but not above the trigger) the policy alerts. */
    private double alertVocabularyThreshold = 0.08;
    private double alertDistributionThreshold = 0.05;

    private int minSampleMessages = 1;

    private int maxEmergentTerms = 10;
    private long minEmergentCount = 3;
    /** Sample relative frequency must be this many times the reference one to count as emergent. */
    private double emergenceRatio = 10.0;

    /** Live messages kept for the sample profile (oldest evicted first). */
    private int sampleWindowSize = 5_000;

    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {
        private String tokenPattern = "[\\p{L}\\p{N}']+";
        private boolean lowercase = true;
        private List<String> stopwords = List.of(
            "a", "an", "the", "and", "or", "to", "of", "in", "on", "is", "it", "for", "you", "your", "i", "me");
        private int maxVocabularySize = 5_000;
        private int minTokenLength = 2;
    }

    public DriftThresholds thresholds() {
        return new DriftThresholds(vocabularyThreshold, distributionThreshold,
            alertVocabularyThreshold, alertDistributionThreshold);
    }

    public FeatureConfig featureConfig() {
        return new FeatureConfig(features.tokenPattern, features.lowercase,
            new LinkedHashSet<>(features.stopwords), features.maxVocabularySize, features.minTokenLength);
    }
}
