package com.driftops.service;

import com.driftops.client.ClassifierApiClient;
import com.driftops.config.CycleProperties;
import com.driftops.entity.DecisionRecord;
import com.driftops.exception.TrainingFailureException;
import com.driftops.model.CycleOutcome;
import com.driftops.model.CycleTrigger;
import com.driftops.model.DecisionAction;
import com.driftops.model.EvaluationSource;
import com.driftops.model.LabeledMessage;
import com.driftops.model.ModelSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Runs one retrain under the {@link RetrainLock}. A successful run registers a new
 * CANDIDATE whose parent is the current production version; a failed or cancelled run
 * leaves the registry untouched and writes an ALERT decision instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainingOrchestrator {

    public static final String REJECTED_IN_PROGRESS = "retrain_in_progress";

    private final RetrainLock retrainLock;
    private final ClassifierApiClient classifierApiClient;
    private final ModelRegistryService registry;
    private final MetricsStoreService metricsStore;
    private final CycleProperties cycleProperties;

    /**
     * Context carried into the retrain so failure records are complete on their own.
     */
    public record RetrainRequest(
        String cycleId,
        CycleTrigger trigger,
        UUID driftReportId,
        String policyName,
        String reasoning,
        List<LabeledMessage> trainingData
    ) {}

    public enum Status { CANDIDATE, REJECTED, FAILED, CANCELLED }

    public record RetrainOutcome(Status status, ModelSnapshot candidate, String reason, DecisionRecord alert) {

        static RetrainOutcome candidate(ModelSnapshot version) {
            return new RetrainOutcome(Status.CANDIDATE, version, null, null);
        }

        static RetrainOutcome rejected(String reason) {
            return new RetrainOutcome(Status.REJECTED, null, reason, null);
        }

        static RetrainOutcome failed(String reason, DecisionRecord alert) {
            return new RetrainOutcome(Status.FAILED, null, reason, alert);
        }

        static RetrainOutcome cancelled(String reason, DecisionRecord alert) {
            return new RetrainOutcome(Status.CANCELLED, null, reason, alert);
        }
    }

    public RetrainOutcome triggerRetrain(RetrainRequest request) {
        Optional<RetrainLock.Lease> acquired = retrainLock.tryAcquire(request.cycleId());
        if (acquired.isEmpty()) {
            log.warn("Retrain rejected, lock held | cycleId={} | holder={}",
                request.cycleId(), retrainLock.holder().orElse("?"));
            return RetrainOutcome.rejected(REJECTED_IN_PROGRESS);
        }
        try (RetrainLock.Lease lease = acquired.get()) {
            return train(request);
        } catch (RuntimeException ex) {
            if (isCancellation(ex)) {
                return RetrainOutcome.cancelled("training interrupted",
                    recordAlert(request, CycleOutcome.TRAINING_CANCELLED, "Training was cancelled before completion."));
            }
            String reason = describe(ex);
            log.error("Retrain failed | cycleId={} | reason={}", request.cycleId(), reason);
            return RetrainOutcome.failed(reason,
                recordAlert(request, CycleOutcome.TRAINING_FAILED, "Training failed: " + reason + "."));
        }
    }

    private RetrainOutcome train(RetrainRequest request) {
        List<LabeledMessage> data = request.trainingData() == null ? List.of()
            : request.trainingData().stream().filter(LabeledMessage::isLabelled).toList();
        if (data.isEmpty()) {
            throw new TrainingFailureException("no labelled training data available");
        }
        String parentId = registry.currentProduction().map(ModelSnapshot::id).orElse(null);
        log.info("Retrain started | cycleId={} | samples={} | parent={}", request.cycleId(), data.size(), parentId);

        ClassifierApiClient.TrainResult result = classifierApiClient.train(data, request.cycleId())
            .timeout(cycleProperties.getTrainingTimeout())
            .block();
        if (result == null) {
            throw new TrainingFailureException("trainer returned an empty response");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new TrainingFailureException("training interrupted", new InterruptedException());
        }
        int samples = result.samples() > 0 ? result.samples() : data.size();
        ModelSnapshot candidate = registry.registerCandidate(
            result.artifactUri(), result.metrics(), samples, parentId, request.cycleId());
        try {
            metricsStore.appendEvaluation(request.cycleId(), candidate.id(), EvaluationSource.TRAINING,
                result.metrics(), samples);
        } catch (RuntimeException ex) {
            // a candidate without its training evaluation must not stay pending
            log.error("Training evaluation not recorded, archiving candidate | cycleId={} | candidate={}",
                request.cycleId(), candidate.id());
            try {
                registry.archiveCandidate(candidate.id(), "training evaluation not recorded", request.cycleId());
            } catch (RuntimeException archiveFailure) {
                ex.addSuppressed(archiveFailure);
            }
            throw ex;
        }
        return RetrainOutcome.candidate(candidate);
    }

    private DecisionRecord recordAlert(RetrainRequest request, CycleOutcome outcome, String detail) {
        // clear the flag so the store write is not aborted, then restore it for the caller
        boolean interrupted = Thread.interrupted();
        try {
            return metricsStore.appendDecision(DecisionRecord.builder()
                .cycleId(request.cycleId())
                .driftReportId(request.driftReportId())
                .policyUsed(request.policyName())
                .action(DecisionAction.ALERT)
                .outcome(outcome)
                .trigger(request.trigger())
                .reasoning(join(request.reasoning(), detail)));
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    static boolean isCancellation(Throwable ex) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException) {
                return "training timed out";
            }
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static String join(String reasoning, String detail) {
        return reasoning == null || reasoning.isBlank() ? detail : reasoning + " " + detail;
    }
}
