package com.driftops.service;

import com.driftops.config.DriftProperties;
import com.driftops.exception.IncomparableProfilesException;
import com.driftops.exception.InsufficientDataException;
import com.driftops.exception.NoBaselineException;
import com.driftops.model.DataProfile;
import com.driftops.model.DriftReport;
import com.driftops.model.DriftThresholds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DriftDetectorService {

    private static final double LN2 = Math.log(2.0);

    private final DriftProperties properties;
    private final Clock clock;

    public DriftReport computeDrift(DataProfile reference, DataProfile sample) {
        return computeDrift(reference, sample, properties.thresholds());
    }

    public DriftReport computeDrift(DataProfile reference, DataProfile sample, DriftThresholds thresholds) {
        if (reference == null) {
            throw new NoBaselineException();
        }
        int minMessages = Math.max(1, properties.getMinSampleMessages());
        if (sample == null || sample.messageCount() < minMessages || sample.totalTokens() == 0) {
            throw new InsufficientDataException(sample == null ? 0 : sample.messageCount(), minMessages);
        }
        if (!reference.featureFingerprint().equals(sample.featureFingerprint())) {
            throw new IncomparableProfilesException(reference.featureFingerprint(), sample.featureFingerprint());
        }

        double vocabularyDrift = round(vocabularyDrift(reference, sample));
        double distributionDrift = round(distributionDrift(reference, sample));
        List<String> emergent = emergentTerms(reference, sample);

        DriftReport report = new DriftReport(
            vocabularyDrift, distributionDrift, emergent,
            thresholds.vocabulary(), thresholds.distribution(),
            thresholds.alertVocabulary(), thresholds.alertDistribution(),
            reference.messageCount(), sample.messageCount(),
            Instant.now(clock));

        log.info("Drift computed | vocabulary={} | distribution={} | detected={} | emergent={}",
            vocabularyDrift, distributionDrift, report.driftDetected(), emergent);
        return report;
    }

    /**
     * Share of the sample's token mass that falls on terms unknown to the reference.
     */
    double vocabularyDrift(DataProfile reference, DataProfile sample) {
        long unseen = 0;
        for (Map.Entry<String, Long> entry : sample.termCounts().entrySet()) {
            if (!reference.termCounts().containsKey(entry.getKey())) {
                unseen += entry.getValue();
            }
        }
        return clamp((double) unseen / sample.totalTokens());
    }

    /**
     * Jensen-Shannon divergence (base 2) over the shared vocabulary, renormalised on both sides.
     */
    double distributionDrift(DataProfile reference, DataProfile sample) {
        long refShared = 0;
        long sampleShared = 0;
        for (Map.Entry<String, Long> entry : sample.termCounts().entrySet()) {
            Long refCount = reference.termCounts().get(entry.getKey());
            if (refCount != null) {
                refShared += refCount;
                sampleShared += entry.getValue();
            }
        }
        if (refShared == 0 || sampleShared == 0) {
            return 1.0;
        }

        double divergence = 0.0;
        for (Map.Entry<String, Long> entry : sample.termCounts().entrySet()) {
            Long refCount = reference.termCounts().get(entry.getKey());
            if (refCount == null) {
                continue;
            }
            double p = (double) refCount / refShared;
            double q = (double) entry.getValue() / sampleShared;
            double m = (p + q) / 2.0;
            divergence += 0.5 * p * Math.log(p / m) + 0.5 * q * Math.log(q / m);
        }
        return clamp(divergence / LN2);
    }

    List<String> emergentTerms(DataProfile reference, DataProfile sample) {
        double ratio = properties.getEmergenceRatio();
        return sample.termCounts().entrySet().stream()
            .filter(e -> e.getValue() >= properties.getMinEmergentCount())
            .filter(e -> {
                double refFreq = reference.relativeFrequency(e.getKey());
                return refFreq == 0.0 || sample.relativeFrequency(e.getKey()) >= ratio * refFreq;
            })
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(Math.max(0, properties.getMaxEmergentTerms()))
            .map(Map.Entry::getKey)
            .toList();
    }

    private double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }

    private double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
