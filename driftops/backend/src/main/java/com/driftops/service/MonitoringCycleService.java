package com.driftops.service;

import com.driftops.config.CycleProperties;
import com.driftops.config.PromotionProperties;
import com.driftops.dto.CycleStateResponse;
import com.driftops.entity.DecisionRecord;
import com.driftops.exception.DriftOpsException;
import com.driftops.exception.InvalidRequestException;
import com.driftops.exception.RetrainInProgressException;
import com.driftops.model.CycleOutcome;
import com.driftops.model.CycleState;
import com.driftops.model.CycleTrigger;
import com.driftops.model.DataProfile;
import com.driftops.model.DecisionAction;
import com.driftops.model.DriftReport;
import com.driftops.model.LabeledMessage;
import com.driftops.model.ModelSnapshot;
import com.driftops.model.ModelStage;
import com.driftops.notification.NotificationDispatcher;
import com.driftops.policy.DecisionPolicyRegistry;
import com.driftops.policy.PolicyDecision;
import com.driftops.policy.PolicyInput;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One monitoring cycle: compute drift, decide, optionally retrain and compare, record.
 * Cycles run on a small worker pool under {@code mlops.cycle.timeout}; whichever of the
 * worker or the timeout handler records first owns the cycle's decision record. A worker
 * result that changed the registry after that point is still appended under the same
 * cycle id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringCycleService {

    public static final String BOOTSTRAP_POLICY = "bootstrap";
    public static final String AB_TEST_POLICY = "ab-test";
    public static final String CYCLE_POLICY = "cycle";
    public static final String OPERATOR_POLICY = "operator";

    private final DataWindowService dataWindow;
    private final DriftDetectorService driftDetector;
    private final MetricsStoreService metricsStore;
    private final DecisionPolicyRegistry policies;
    private final RetrainGuard retrainGuard;
    private final RetrainingOrchestrator orchestrator;
    private final ModelComparatorService comparator;
    private final ModelRegistryService registry;
    private final TrafficRouterService trafficRouter;
    private final RetrainLock retrainLock;
    private final NotificationDispatcher notifications;
    private final CycleProperties cycleProperties;
    private final PromotionProperties promotionProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, CycleContext> running = new ConcurrentHashMap<>();
    private final AtomicReference<List<LabeledMessage>> pendingTrainingData = new AtomicReference<>();
    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, cycleProperties.getWorkerThreads()));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public DecisionRecord runCycle(CycleTrigger trigger) {
        if (trigger != CycleTrigger.SCHEDULED && trigger != CycleTrigger.MANUAL) {
            throw new InvalidRequestException("Cycles are triggered SCHEDULED or MANUAL, got " + trigger);
        }
        CycleContext ctx = new CycleContext(UUID.randomUUID().toString(), trigger, Instant.now(clock));
        return submitAndAwait(ctx, () -> execute(ctx));
    }

    /**
     * Operator-requested retrain. Skips drift gating and the rejection/cooldown guard, but
     * not the retrain lock or a running A/B test.
     */
    public DecisionRecord forceRetrain(String requestedBy) {
        if (retrainLock.isHeld()) {
            throw new RetrainInProgressException(retrainLock.holder().orElse("unknown"));
        }
        String operator = requestedBy == null || requestedBy.isBlank() ? "operator" : requestedBy;
        CycleContext ctx = new CycleContext(UUID.randomUUID().toString(), CycleTrigger.OPERATOR, Instant.now(clock));
        return submitAndAwait(ctx, () -> executeForced(ctx, operator));
    }

    private DecisionRecord submitAndAwait(CycleContext ctx, Callable<DecisionRecord> body) {
        running.put(ctx.cycleId, ctx);
        log.info("Cycle started | cycleId={} | trigger={}", ctx.cycleId, ctx.trigger);

        Future<DecisionRecord> future = executor.submit(body);
        Duration timeout = cycleProperties.getTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.error("Cycle timed out | cycleId={} | timeout={} | state={}", ctx.cycleId, timeout, ctx.state);
            Optional<DecisionRecord> record = recordIfUnclaimed(ctx, CycleOutcome.CYCLE_TIMED_OUT,
                "Cycle exceeded its timeout of " + timeout + " while " + ctx.state + "; cancellation requested.", null);
            future.cancel(true);
            return record.orElseGet(() -> awaitWorker(future, ctx));
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("Cycle failed unexpectedly | cycleId={} | error={}", ctx.cycleId, cause.getMessage(), cause);
            String reasoning = ctx.unrecordedOutcome == null
                ? "Cycle failed unexpectedly: " + describe(cause) + "."
                : "Cycle failed unexpectedly while recording " + ctx.unrecordedOutcome
                    + (ctx.unrecordedVersion == null ? "" : " for " + ctx.unrecordedVersion) + ": " + describe(cause) + ".";
            Optional<DecisionRecord> record = recordIfUnclaimed(ctx, CycleOutcome.CYCLE_FAILED, reasoning, ctx.unrecordedVersion);
            if (record.isPresent()) {
                return record.get();
            }
            if (ctx.record != null) {
                return ctx.record;
            }
            throw new IllegalStateException("Cycle " + ctx.cycleId + " failed and its record is unavailable", cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            recordIfUnclaimed(ctx, CycleOutcome.CYCLE_FAILED, "Cycle was cancelled by its caller.", null);
            Thread.currentThread().interrupt();
            throw new CancellationException("Cycle " + ctx.cycleId + " cancelled");
        } finally {
            if (future.isDone()) {
                running.remove(ctx.cycleId);
            }
        }
    }

    public CycleStateResponse state() {
        List<CycleStateResponse.RunningCycle> cycles = running.values().stream()
            .sorted(Comparator.comparing(c -> c.startedAt))
            .map(c -> CycleStateResponse.RunningCycle.builder()
                .cycleId(c.cycleId)
                .trigger(c.trigger)
                .state(c.state)
                .startedAt(c.startedAt)
                .build())
            .toList();
        return CycleStateResponse.builder()
            .running(cycles)
            .retrainInProgress(retrainLock.isHeld())
            .retrainHolder(retrainLock.holder().orElse(null))
            .promotionsHalted(registry.isHalted())
            .haltReason(registry.haltReason().orElse(null))
            .productionVersion(registry.currentProduction().map(ModelSnapshot::id).orElse(null))
            .candidateVersion(registry.currentCandidate().map(ModelSnapshot::id).orElse(null))
            .abTest(trafficRouter.snapshot().map(TrafficRouterService::toResponse).orElse(null))
            .build();
    }

    DecisionRecord execute(CycleContext ctx) {
        try {
            Optional<String> rebasedOnto = settlePendingTest(ctx);
            if (rebasedOnto.isPresent()) {
                // the live window was cleared by the rebase; drift resumes next cycle
                return finish(ctx, new PolicyDecision(DecisionAction.NO_ACTION,
                        "Reference rebased onto " + rebasedOnto.get()
                            + " after its A/B test settled; drift is measured from the next cycle.", AB_TEST_POLICY),
                    CycleOutcome.NO_ACTION, null);
            }

            DataProfile reference = dataWindow.referenceProfile().orElse(null);
            DriftReport report = driftDetector.computeDrift(reference, dataWindow.sampleProfile());
            ctx.driftReportId = metricsStore.appendDriftReport(ctx.cycleId, report).getId();
            ctx.advance(CycleState.DRIFT_COMPUTED);

            Optional<ModelSnapshot> production = registry.currentProduction();
            PolicyDecision decision = decide(report, production);
            ctx.advance(CycleState.DECIDED);
            log.info("Cycle decided | cycleId={} | policy={} | action={} | vocabularyDrift={} | distributionDrift={}",
                ctx.cycleId, decision.policyName(), decision.action(), report.vocabularyDrift(), report.distributionDrift());

            return switch (decision.action()) {
                case NO_ACTION -> finish(ctx, decision, CycleOutcome.NO_ACTION, null);
                case ALERT -> finish(ctx, decision, CycleOutcome.ALERTED, null);
                case RETRAIN -> retrain(ctx, decision, production.orElse(null), true);
            };
        } catch (DriftOpsException ex) {
            log.warn("Cycle failed | cycleId={} | state={} | code={} | error={}",
                ctx.cycleId, ctx.state, ex.getErrorCode(), ex.getMessage());
            return finish(ctx, new PolicyDecision(DecisionAction.ALERT,
                "Cycle failed [" + ex.getErrorCode() + "]: " + ex.getMessage(), CYCLE_POLICY), CycleOutcome.CYCLE_FAILED, null);
        } finally {
            running.remove(ctx.cycleId);
        }
    }

    DecisionRecord executeForced(CycleContext ctx, String operator) {
        try {
            ctx.advance(CycleState.DECIDED);
            PolicyDecision decision = new PolicyDecision(DecisionAction.RETRAIN,
                "Retrain requested by " + operator + ".", OPERATOR_POLICY);
            return retrain(ctx, decision, registry.currentProduction().orElse(null), false);
        } catch (DriftOpsException ex) {
            log.warn("Forced retrain failed | cycleId={} | code={} | error={}", ctx.cycleId, ex.getErrorCode(), ex.getMessage());
            return finish(ctx, new PolicyDecision(DecisionAction.ALERT,
                "Forced retrain failed [" + ex.getErrorCode() + "]: " + ex.getMessage(), OPERATOR_POLICY),
                CycleOutcome.CYCLE_FAILED, null);
        } finally {
            running.remove(ctx.cycleId);
        }
    }

    private PolicyDecision decide(DriftReport report, Optional<ModelSnapshot> production) {
        if (production.isEmpty()) {
            return new PolicyDecision(DecisionAction.RETRAIN,
                "No production model is registered; training the first one.", BOOTSTRAP_POLICY);
        }
        ModelSnapshot current = production.get();
        Double accuracy = metricsStore.latestAccuracy(current.id()).orElse(current.accuracy());
        Duration sinceLastCheck = metricsStore.latestDecision()
            .map(d -> Duration.between(d.getRecordedAt(), Instant.now(clock)))
            .orElse(null);
        return policies.active().decide(new PolicyInput(report, accuracy, sinceLastCheck));
    }

    private DecisionRecord retrain(CycleContext ctx, PolicyDecision decision, ModelSnapshot production, boolean guarded) {
        RetrainGuard.GuardDecision guard = guarded ? retrainGuard.check() : retrainGuard.checkPendingTest();
        if (!guard.allowed()) {
            log.warn("Retrain suppressed | cycleId={} | reason={}", ctx.cycleId, guard.reason());
            return finish(ctx, new PolicyDecision(DecisionAction.ALERT,
                    join(decision.reasoning(), "Retrain suppressed: " + guard.reason() + "."), decision.policyName()),
                CycleOutcome.RETRAIN_SUPPRESSED, null);
        }

        ctx.advance(CycleState.RETRAINING);
        List<LabeledMessage> trainingData = dataWindow.trainingData();
        RetrainingOrchestrator.RetrainOutcome outcome = orchestrator.triggerRetrain(new RetrainingOrchestrator.RetrainRequest(
            ctx.cycleId, ctx.trigger, ctx.driftReportId, decision.policyName(), decision.reasoning(), trainingData));

        switch (outcome.status()) {
            case REJECTED:
                return finish(ctx, new PolicyDecision(DecisionAction.RETRAIN,
                        join(decision.reasoning(), "Retrain rejected: another retrain is in progress."), decision.policyName()),
                    CycleOutcome.RETRAIN_REJECTED, null);
            case FAILED:
            case CANCELLED:
                return adopt(ctx, outcome.alert());
            default:
                break;
        }

        ModelSnapshot candidate = outcome.candidate();
        if (production != null && promotionProperties.getMetricSource() == PromotionProperties.MetricSource.AB_TEST) {
            double split = promotionProperties.getAbTest().getSplitRatio();
            trafficRouter.startTest(production, candidate, split, ctx.cycleId);
            pendingTrainingData.set(trainingData);
            return finish(ctx, new PolicyDecision(DecisionAction.RETRAIN,
                    join(decision.reasoning(), "Candidate " + candidate.id() + " placed under A/B test at split " + split + "."),
                    decision.policyName()),
                CycleOutcome.CANDIDATE_UNDER_TEST, candidate.id());
        }

        ModelComparatorService.ComparisonResult result = comparator.compareAndPromote(
            candidate, production, promotionProperties.getMargin(), ctx.cycleId);
        ctx.advance(CycleState.COMPARED);
        if (result.verdict() == ModelComparatorService.Verdict.PROMOTE) {
            dataWindow.rebaseReference(trainingData);
        }
        return finish(ctx, comparisonDecision(decision, result), comparisonOutcome(result), result.candidateId());
    }

    /**
     * Settles a candidate under A/B test once enough outcomes are labelled or the test ran
     * out of time. Failures are logged and leave the test running.
     *
     * @return the promoted version when the reference corpus was rebased onto it
     */
    private Optional<String> settlePendingTest(CycleContext ctx) {
        Optional<TrafficRouterService.AbTestSnapshot> live = trafficRouter.snapshot();
        if (live.isEmpty()) {
            return Optional.empty();
        }
        TrafficRouterService.AbTestSnapshot stats = live.get();
        PromotionProperties.AbTest settings = promotionProperties.getAbTest();
        boolean enough = stats.minLabelled() >= settings.getMinLabelledPerArm();
        boolean expired = Duration.between(stats.config().startedAt(), Instant.now(clock))
            .compareTo(settings.getMaxDuration()) >= 0;
        if (!enough && !expired) {
            log.debug("A/B test still collecting | candidate={} | labelled={}",
                stats.config().candidateVersion(), stats.minLabelled());
            return Optional.empty();
        }

        Optional<ModelSnapshot> candidate = registry.find(stats.config().candidateVersion())
            .filter(v -> v.stage() == ModelStage.CANDIDATE);
        if (candidate.isEmpty()) {
            log.warn("A/B test candidate no longer pending, discarding test | candidate={}", stats.config().candidateVersion());
            trafficRouter.conclude();
            pendingTrainingData.set(null);
            return Optional.empty();
        }
        try {
            ModelComparatorService.ComparisonResult result = comparator.compareAndPromote(
                candidate.get(), registry.currentProduction().orElse(null), promotionProperties.getMargin(), ctx.cycleId);
            List<LabeledMessage> data = pendingTrainingData.getAndSet(null);
            boolean rebase = result.verdict() == ModelComparatorService.Verdict.PROMOTE && data != null;
            String why = enough ? "enough labelled outcomes" : "maximum test duration reached";
            PolicyDecision decision = new PolicyDecision(DecisionAction.RETRAIN, "A/B test settled (" + why + ").", AB_TEST_POLICY);
            CycleOutcome outcome = comparisonOutcome(result);
            ctx.markUnrecorded(outcome, result.candidateId());
            DecisionRecord record = metricsStore.appendDecision(DecisionRecord.builder()
                .cycleId(ctx.cycleId)
                .policyUsed(AB_TEST_POLICY)
                .action(result.evaluationFailed() ? DecisionAction.ALERT : DecisionAction.RETRAIN)
                .outcome(outcome)
                .trigger(CycleTrigger.POLICY)
                .reasoning(comparisonDecision(decision, result).reasoning())
                .resultingVersionId(result.candidateId()));
            ctx.markUnrecorded(null, null);
            notifications.dispatch(record);
            if (rebase) {
                dataWindow.rebaseReference(data);
                return Optional.of(result.candidateId());
            }
        } catch (DriftOpsException ex) {
            log.error("A/B settlement failed | cycleId={} | candidate={} | error={}",
                ctx.cycleId, stats.config().candidateVersion(), ex.getMessage());
        }
        return Optional.empty();
    }

    private static PolicyDecision comparisonDecision(PolicyDecision decision, ModelComparatorService.ComparisonResult result) {
        DecisionAction action = result.evaluationFailed() ? DecisionAction.ALERT : DecisionAction.RETRAIN;
        return new PolicyDecision(action, join(decision.reasoning(), result.describe()), decision.policyName());
    }

    private static CycleOutcome comparisonOutcome(ModelComparatorService.ComparisonResult result) {
        if (result.evaluationFailed()) {
            return CycleOutcome.EVALUATION_FAILED;
        }
        return result.verdict() == ModelComparatorService.Verdict.PROMOTE
            ? CycleOutcome.CANDIDATE_PROMOTED : CycleOutcome.CANDIDATE_ARCHIVED;
    }

    private DecisionRecord finish(CycleContext ctx, PolicyDecision decision, CycleOutcome outcome, String versionId) {
        DecisionRecord.DecisionRecordBuilder builder = DecisionRecord.builder()
            .cycleId(ctx.cycleId)
            .driftReportId(ctx.driftReportId)
            .policyUsed(decision.policyName())
            .action(decision.action())
            .outcome(outcome)
            .trigger(ctx.trigger)
            .resultingVersionId(versionId);
        if (!ctx.claim()) {
            if (versionId == null) {
                log.warn("Cycle already recorded, dropping late result | cycleId={} | outcome={}", ctx.cycleId, outcome);
                return ctx.record;
            }
            // the registry already moved, so the earlier record alone would misstate the cycle
            log.warn("Cycle already recorded, appending late result | cycleId={} | outcome={} | version={}",
                ctx.cycleId, outcome, versionId);
            String recordedAs = ctx.record != null ? ctx.record.getOutcome().name() : "closed";
            DecisionRecord late = appendClearingInterrupt(builder.reasoning(
                join("Completed after the cycle had already been recorded as " + recordedAs + ".", decision.reasoning())));
            notifications.dispatch(late);
            return late;
        }
        ctx.markUnrecorded(outcome, versionId);
        DecisionRecord record;
        try {
            record = metricsStore.appendDecision(builder.reasoning(decision.reasoning()));
        } catch (RuntimeException ex) {
            ctx.release();
            throw ex;
        }
        ctx.markUnrecorded(null, null);
        return complete(ctx, record);
    }

    /** Uses a record the orchestrator already wrote as this cycle's outcome. */
    private DecisionRecord adopt(CycleContext ctx, DecisionRecord record) {
        if (!ctx.claim()) {
            return record;
        }
        return complete(ctx, record);
    }

    private DecisionRecord complete(CycleContext ctx, DecisionRecord record) {
        ctx.record = record;
        ctx.advance(CycleState.RECORDED);
        notifications.dispatch(record);
        log.info("Cycle recorded | cycleId={} | action={} | outcome={} | durationMs={}",
            ctx.cycleId, record.getAction(), record.getOutcome(),
            Duration.between(ctx.startedAt, Instant.now(clock)).toMillis());
        ctx.advance(CycleState.IDLE);
        return record;
    }

    private Optional<DecisionRecord> recordIfUnclaimed(CycleContext ctx, CycleOutcome outcome, String reasoning,
                                                       String versionId) {
        if (!ctx.claim()) {
            return Optional.empty();
        }
        DecisionRecord record;
        try {
            record = appendClearingInterrupt(DecisionRecord.builder()
                .cycleId(ctx.cycleId)
                .driftReportId(ctx.driftReportId)
                .policyUsed(CYCLE_POLICY)
                .action(DecisionAction.ALERT)
                .outcome(outcome)
                .trigger(ctx.trigger)
                .reasoning(reasoning)
                .resultingVersionId(versionId));
        } catch (RuntimeException ex) {
            ctx.release();
            throw ex;
        }
        return Optional.of(complete(ctx, record));
    }

    private DecisionRecord appendClearingInterrupt(DecisionRecord.DecisionRecordBuilder builder) {
        // clear the flag so the store write is not aborted, then restore it for the caller
        boolean interrupted = Thread.interrupted();
        try {
            return metricsStore.appendDecision(builder);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private DecisionRecord awaitWorker(Future<DecisionRecord> future, CycleContext ctx) {
        // the worker claimed the record just before the timeout fired; it only has the append left
        try {
            return future.get(cycleProperties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (CancellationException | ExecutionException | TimeoutException ex) {
            if (ctx.record != null) {
                return ctx.record;
            }
            // the worker's own append failed and released the claim
            return recordIfUnclaimed(ctx, CycleOutcome.CYCLE_TIMED_OUT,
                    "Cycle exceeded its timeout of " + cycleProperties.getTimeout() + " and its result could not be recorded: "
                        + describe(ex.getCause() != null ? ex.getCause() : ex) + ".", ctx.unrecordedVersion)
                .orElseThrow(() -> new IllegalStateException("Cycle " + ctx.cycleId + " recorded but its result is unavailable", ex));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Cycle " + ctx.cycleId + " cancelled");
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static String join(String reasoning, String detail) {
        return reasoning == null || reasoning.isBlank() ? detail : reasoning + " " + detail;
    }

    static final class CycleContext {
        private final String cycleId;
        private final CycleTrigger trigger;
        private final Instant startedAt;
        private final AtomicBoolean recorded = new AtomicBoolean();
        private volatile CycleState state = CycleState.IDLE;
        private volatile UUID driftReportId;
        private volatile DecisionRecord record;
        private volatile CycleOutcome unrecordedOutcome;
        private volatile String unrecordedVersion;

        CycleContext(String cycleId, CycleTrigger trigger, Instant startedAt) {
            this.cycleId = cycleId;
            this.trigger = trigger;
            this.startedAt = startedAt;
        }

        private boolean claim() {
            return recorded.compareAndSet(false, true);
        }

        private void release() {
            recorded.set(false);
        }

        private void markUnrecorded(CycleOutcome outcome, String versionId) {
            this.unrecordedOutcome = outcome;
            this.unrecordedVersion = versionId;
        }

        private void advance(CycleState next) {
            this.state = next;
        }
    }
}
