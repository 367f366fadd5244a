package com.driftops.policy;

import com.driftops.config.PolicyProperties;
import com.driftops.model.DecisionAction;
import com.driftops.model.DriftReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class RuleBasedDecisionPolicy implements DecisionPolicy {

    public static final String NAME = "rule-based";

    private final PolicyProperties policyProperties;

    @Override
    public PolicyProperties.Mode mode() {
        return PolicyProperties.Mode.RULE_BASED;
    }

    @Override
    public PolicyDecision decide(PolicyInput input) {
        DriftReport report = input.report();
        double floor = policyProperties.getAccuracyFloor();
        Double accuracy = input.currentAccuracy();

        List<String> causes = new ArrayList<>();
        if (report.vocabularyDriftDetected()) {
            causes.add(fmt("vocabulary drift %.4f exceeds threshold %.4f", report.vocabularyDrift(), report.vocabularyThreshold()));
        }
        if (report.distributionDriftDetected()) {
            causes.add(fmt("distribution drift %.4f exceeds threshold %.4f", report.distributionDrift(), report.distributionThreshold()));
        }
        if (accuracy != null && accuracy < floor) {
            causes.add(fmt("production accuracy %.4f is below floor %.4f", accuracy, floor));
        }

        if (!causes.isEmpty()) {
            return new PolicyDecision(DecisionAction.RETRAIN, "Retrain: " + String.join("; ", causes) + emergentSuffix(report), NAME);
        }

        boolean vocabElevated = report.vocabularyDriftElevated();
        boolean distElevated = report.distributionDriftElevated();
        if (vocabElevated || distElevated) {
            List<String> elevated = new ArrayList<>();
            if (vocabElevated) {
                elevated.add(fmt("vocabulary drift %.4f above alert level %.4f", report.vocabularyDrift(), report.alertVocabularyThreshold()));
            }
            if (distElevated) {
                elevated.add(fmt("distribution drift %.4f above alert level %.4f", report.distributionDrift(), report.alertDistributionThreshold()));
            }
            return new PolicyDecision(DecisionAction.ALERT,
                "Elevated drift below retrain trigger: " + String.join("; ", elevated) + emergentSuffix(report), NAME);
        }

        String accuracyPart = accuracy == null ? "no production accuracy available"
            : fmt("accuracy %.4f at or above floor %.4f", accuracy, floor);
        return new PolicyDecision(DecisionAction.NO_ACTION,
            fmt("Drift within limits (vocabulary %.4f, distribution %.4f); ", report.vocabularyDrift(), report.distributionDrift())
                + accuracyPart, NAME);
    }

    private String emergentSuffix(DriftReport report) {
        return report.emergentTerms().isEmpty() ? "" : " | emergent terms: " + String.join(", ", report.emergentTerms());
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
