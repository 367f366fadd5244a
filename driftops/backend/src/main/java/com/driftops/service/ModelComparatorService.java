package com.driftops.service;

import com.driftops.client.ClassifierApiClient;
import com.driftops.config.CycleProperties;
import com.driftops.config.PromotionProperties;
import com.driftops.exception.InsufficientDataException;
import com.driftops.model.EvaluationSource;
import com.driftops.model.LabeledMessage;
import com.driftops.model.ModelMetrics;
import com.driftops.model.ModelSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares a candidate against production and applies the result to the registry.
 * Accuracy is the only gate; precision, recall and F1 are recorded for reference.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelComparatorService {

    static final double TOLERANCE = 1e-9;

    private final ClassifierApiClient classifierApiClient;
    private final ModelRegistryService registry;
    private final MetricsStoreService metricsStore;
    private final DataWindowService dataWindow;
    private final TrafficRouterService trafficRouter;
    private final PromotionProperties promotionProperties;
    private final CycleProperties cycleProperties;

    public enum Verdict { PROMOTE, ARCHIVE }

    public record ComparisonResult(
        Verdict verdict,
        String candidateId,
        String productionId,
        double candidateAccuracy,
        double productionAccuracy,
        double delta,
        EvaluationSource source,
        String failureReason
    ) {

        public boolean evaluationFailed() {
            return failureReason != null;
        }

        public String describe() {
            if (evaluationFailed()) {
                return "Evaluation of " + candidateId + " failed: " + failureReason + "; candidate archived.";
            }
            if (productionId == null) {
                return String.format(Locale.ROOT, "No production model; %s promoted with accuracy %.4f.",
                    candidateId, candidateAccuracy);
            }
            return String.format(Locale.ROOT, "%s accuracy %.4f vs %s %.4f (delta %+.4f, %s): %s.",
                candidateId, candidateAccuracy, productionId, productionAccuracy, delta,
                source.name().toLowerCase(Locale.ROOT), verdict == Verdict.PROMOTE ? "promoted" : "archived");
        }
    }

    /**
     * Promotes iff the candidate beats production by at least {@code margin}. Equal or lower
     * accuracy always archives, whatever the margin. With no production version the
     * candidate becomes the first production model.
     */
    public static Verdict gate(double candidateAccuracy, double productionAccuracy, double margin) {
        double delta = candidateAccuracy - productionAccuracy;
        return delta > 0 && delta + TOLERANCE >= margin ? Verdict.PROMOTE : Verdict.ARCHIVE;
    }

    public ComparisonResult compareAndPromote(ModelSnapshot candidate, ModelSnapshot production,
                                              double margin, String cycleId) {
        ComparisonResult result;
        try {
            result = production == null ? bootstrap(candidate, cycleId) : compare(candidate, production, margin, cycleId);
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Evaluation failed | candidate={} | cycleId={} | reason={}", candidate.id(), cycleId, reason);
            concludeTestFor(candidate);
            registry.archiveCandidate(candidate.id(), "evaluation failed: " + reason, cycleId);
            return new ComparisonResult(Verdict.ARCHIVE, candidate.id(), production == null ? null : production.id(),
                0.0, 0.0, 0.0, EvaluationSource.HOLDOUT, reason);
        }

        concludeTestFor(candidate);
        if (result.verdict() == Verdict.PROMOTE) {
            registry.promote(candidate.id(), result.describe(), cycleId);
        } else {
            registry.archiveCandidate(candidate.id(), result.describe(), cycleId);
        }
        log.info("Comparison | candidate={} | production={} | delta={} | source={} | verdict={} | cycleId={}",
            result.candidateId(), result.productionId(), result.delta(), result.source(), result.verdict(), cycleId);
        return result;
    }

    private ComparisonResult bootstrap(ModelSnapshot candidate, String cycleId) {
        List<LabeledMessage> holdout = dataWindow.holdout();
        double accuracy = candidate.accuracy();
        EvaluationSource source = EvaluationSource.TRAINING;
        if (!holdout.isEmpty()) {
            ModelMetrics metrics = evaluate(candidate, holdout, cycleId).block(cycleProperties.getEvaluationTimeout());
            metricsStore.appendEvaluation(cycleId, candidate.id(), EvaluationSource.HOLDOUT, metrics, holdout.size());
            accuracy = metrics.accuracy();
            source = EvaluationSource.HOLDOUT;
        }
        return new ComparisonResult(Verdict.PROMOTE, candidate.id(), null, accuracy, 0.0, accuracy, source, null);
    }

    private ComparisonResult compare(ModelSnapshot candidate, ModelSnapshot production, double margin, String cycleId) {
        Optional<TrafficRouterService.AbTestSnapshot> live = liveStats(candidate);
        if (live.isPresent()) {
            TrafficRouterService.AbTestSnapshot stats = live.get();
            double candidateAccuracy = stats.candidate().accuracy();
            double productionAccuracy = stats.production().accuracy();
            metricsStore.appendEvaluation(cycleId, candidate.id(), EvaluationSource.AB_TEST,
                accuracyOnly(candidateAccuracy), stats.candidate().labelled());
            metricsStore.appendEvaluation(cycleId, production.id(), EvaluationSource.AB_TEST,
                accuracyOnly(productionAccuracy), stats.production().labelled());
            return verdict(candidate, production, candidateAccuracy, productionAccuracy, margin, EvaluationSource.AB_TEST);
        }

        List<LabeledMessage> holdout = dataWindow.holdout();
        if (holdout.isEmpty()) {
            throw new InsufficientDataException(0, 1);
        }
        Tuple2<ModelMetrics, ModelMetrics> scores = Mono.zip(
                evaluate(candidate, holdout, cycleId),
                evaluate(production, holdout, cycleId))
            .block(cycleProperties.getEvaluationTimeout());
        if (scores == null) {
            throw new IllegalStateException("evaluation returned no result");
        }
        metricsStore.appendEvaluation(cycleId, candidate.id(), EvaluationSource.HOLDOUT, scores.getT1(), holdout.size());
        metricsStore.appendEvaluation(cycleId, production.id(), EvaluationSource.HOLDOUT, scores.getT2(), holdout.size());
        return verdict(candidate, production, scores.getT1().accuracy(), scores.getT2().accuracy(), margin,
            EvaluationSource.HOLDOUT);
    }

    private Optional<TrafficRouterService.AbTestSnapshot> liveStats(ModelSnapshot candidate) {
        if (promotionProperties.getMetricSource() != PromotionProperties.MetricSource.AB_TEST) {
            return Optional.empty();
        }
        long required = promotionProperties.getAbTest().getMinLabelledPerArm();
        return trafficRouter.snapshot()
            .filter(s -> s.config().candidateVersion().equals(candidate.id()))
            .filter(s -> s.minLabelled() >= required);
    }

    private void concludeTestFor(ModelSnapshot candidate) {
        trafficRouter.activeTest()
            .filter(t -> t.candidateVersion().equals(candidate.id()))
            .ifPresent(t -> trafficRouter.conclude());
    }

    private Mono<ModelMetrics> evaluate(ModelSnapshot version, List<LabeledMessage> holdout, String cycleId) {
        return classifierApiClient.evaluate(version.artifactUri(), holdout, cycleId);
    }

    private static ComparisonResult verdict(ModelSnapshot candidate, ModelSnapshot production, double candidateAccuracy,
                                            double productionAccuracy, double margin, EvaluationSource source) {
        return new ComparisonResult(gate(candidateAccuracy, productionAccuracy, margin), candidate.id(), production.id(),
            candidateAccuracy, productionAccuracy, candidateAccuracy - productionAccuracy, source, null);
    }

    private static ModelMetrics accuracyOnly(double accuracy) {
        return new ModelMetrics(accuracy, 0.0, 0.0, 0.0);
    }
}
