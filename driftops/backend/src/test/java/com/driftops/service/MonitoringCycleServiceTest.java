package com.driftops.service;

import com.driftops.config.CycleProperties;
import com.driftops.config.PromotionProperties;
import com.driftops.entity.DecisionRecord;
import com.driftops.entity.DriftReportRecord;
import com.driftops.exception.InvalidRequestException;
import com.driftops.exception.NoBaselineException;
import com.driftops.exception.RegistryTransitionConflictException;
import com.driftops.exception.RetrainInProgressException;
import com.driftops.model.CycleOutcome;
import com.driftops.model.CycleTrigger;
import com.driftops.model.DecisionAction;
import com.driftops.model.DriftReport;
import com.driftops.model.EvaluationSource;
import com.driftops.model.LabeledMessage;
import com.driftops.model.ModelMetrics;
import com.driftops.model.ModelSnapshot;
import com.driftops.model.ModelStage;
import com.driftops.notification.NotificationDispatcher;
import com.driftops.notification.NotificationSink;
import com.driftops.policy.DecisionPolicy;
import com.driftops.policy.DecisionPolicyRegistry;
import com.driftops.policy.PolicyDecision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MonitoringCycleServiceTest {

    @Mock DataWindowService dataWindow;
    @Mock DriftDetectorService driftDetector;
    @Mock MetricsStoreService metricsStore;
    @Mock DecisionPolicyRegistry policies;
    @Mock DecisionPolicy policy;
    @Mock RetrainGuard retrainGuard;
    @Mock RetrainingOrchestrator orchestrator;
    @Mock ModelComparatorService comparator;
    @Mock ModelRegistryService registry;
    @Mock TrafficRouterService trafficRouter;
    @Mock NotificationSink sink;

    private final RetrainLock retrainLock = new RetrainLock();
    private final CycleProperties cycleProperties = new CycleProperties();
    private final PromotionProperties promotionProperties = new PromotionProperties();
    private final List<LabeledMessage> trainingData = List.of(new LabeledMessage("free crypto", true));

    private final ModelSnapshot production = version("v1", ModelStage.PRODUCTION, null);
    private final ModelSnapshot candidate = version("v2", ModelStage.CANDIDATE, "v1");
    private final List<DecisionRecord> appended = new CopyOnWriteArrayList<>();

    private MonitoringCycleService service;

    @BeforeEach
    void setUp() {
        cycleProperties.setTimeout(Duration.ofSeconds(5));
        service = new MonitoringCycleService(dataWindow, driftDetector, metricsStore, policies, retrainGuard,
            orchestrator, comparator, registry, trafficRouter, retrainLock,
            new NotificationDispatcher(List.of(sink)), cycleProperties, promotionProperties, Clock.systemUTC());
        service.init();

        when(sink.name()).thenReturn("test-sink");
        when(trafficRouter.snapshot()).thenReturn(Optional.empty());
        when(dataWindow.referenceProfile()).thenReturn(Optional.empty());
        when(dataWindow.trainingData()).thenReturn(trainingData);
        when(driftDetector.computeDrift(any(), any())).thenReturn(report(0.31));
        when(metricsStore.appendDriftReport(anyString(), any()))
            .thenReturn(DriftReportRecord.builder().id(UUID.randomUUID()).build());
        when(metricsStore.appendDecision(any())).thenAnswer(inv -> store(inv.getArgument(0)));
        when(metricsStore.latestAccuracy("v1")).thenReturn(Optional.of(0.95));
        when(metricsStore.latestDecision()).thenReturn(Optional.empty());
        when(registry.currentProduction()).thenReturn(Optional.of(production));
        when(policies.active()).thenReturn(policy);
        when(retrainGuard.check()).thenReturn(new RetrainGuard.GuardDecision(true, null));
        when(retrainGuard.checkPendingTest()).thenReturn(new RetrainGuard.GuardDecision(true, null));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private DecisionRecord store(DecisionRecord.DecisionRecordBuilder builder) {
        DecisionRecord record = builder.recordedAt(Instant.now()).build();
        appended.add(record);
        return record;
    }

    private static ModelSnapshot version(String id, ModelStage stage, String parent) {
        return new ModelSnapshot(id, stage, new ModelMetrics(0.95, 0.9, 0.9, 0.9), parent, "s3://" + id, 10,
            Instant.now(), null, null);
    }

    private static DriftReport report(double vocabularyDrift) {
        return new DriftReport(vocabularyDrift, 0.02, List.of("crypto"), 0.15, 0.10, 0.08, 0.05, 500, 200, Instant.now());
    }

    private void policyDecides(DecisionAction action) {
        when(policy.decide(any())).thenReturn(new PolicyDecision(action, "Vocabulary drift 0.3100.", "rule-based"));
    }

    private static TrafficRouterService.AbTestSnapshot abTest(long labelledPerArm, Instant startedAt) {
        return new TrafficRouterService.AbTestSnapshot(
            new TrafficRouterService.AbTestConfig("v1", "v2", 0.1, startedAt, "cycle-ab"),
            new TrafficRouterService.ArmStats(labelledPerArm * 9, labelledPerArm, labelledPerArm * 9 / 10),
            new TrafficRouterService.ArmStats(labelledPerArm, labelledPerArm, labelledPerArm * 19 / 20));
    }

    private void placeCandidateUnderTest() {
        promotionProperties.setMetricSource(PromotionProperties.MetricSource.AB_TEST);
        policyDecides(DecisionAction.RETRAIN);
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));
        assertThat(service.runCycle(CycleTrigger.SCHEDULED).getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_UNDER_TEST);
        appended.clear();
        clearInvocations(driftDetector, metricsStore, sink);
    }

    private ModelComparatorService.ComparisonResult comparison(ModelComparatorService.Verdict verdict) {
        return new ModelComparatorService.ComparisonResult(verdict, "v2", "v1", 0.96, 0.94, 0.02,
            EvaluationSource.HOLDOUT, null);
    }

    @Test
    void noDrift_recordsNoActionEvenWhenNotificationFails() {
        policyDecides(DecisionAction.NO_ACTION);
        doThrow(new IllegalStateException("webhook down")).when(sink).notify(any());

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getAction()).isEqualTo(DecisionAction.NO_ACTION);
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.NO_ACTION);
        assertThat(record.getTrigger()).isEqualTo(CycleTrigger.SCHEDULED);
        assertThat(record.getDriftReportId()).isNotNull();
        verify(sink).notify(record);
        verifyNoInteractions(orchestrator, comparator);
        assertThat(service.state().getRunning()).isEmpty();
    }

    @Test
    void repeatedCycleOnUnchangedData_recordsSameDecisionAndDrift() {
        policyDecides(DecisionAction.NO_ACTION);

        DecisionRecord first = service.runCycle(CycleTrigger.MANUAL);
        DecisionRecord second = service.runCycle(CycleTrigger.MANUAL);

        assertThat(second.getAction()).isEqualTo(first.getAction());
        assertThat(second.getOutcome()).isEqualTo(first.getOutcome());
        assertThat(second.getReasoning()).isEqualTo(first.getReasoning());
        assertThat(second.getCycleId()).isNotEqualTo(first.getCycleId());
        ArgumentCaptor<DriftReport> reports = ArgumentCaptor.forClass(DriftReport.class);
        verify(metricsStore, times(2)).appendDriftReport(anyString(), reports.capture());
        assertThat(reports.getAllValues().get(1)).isEqualTo(reports.getAllValues().get(0));
    }

    @Test
    void retrainWithBetterCandidate_promotesAndRebasesReference() {
        policyDecides(DecisionAction.RETRAIN);
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString()))
            .thenReturn(comparison(ModelComparatorService.Verdict.PROMOTE));

        DecisionRecord record = service.runCycle(CycleTrigger.MANUAL);

        assertThat(record.getAction()).isEqualTo(DecisionAction.RETRAIN);
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_PROMOTED);
        assertThat(record.getResultingVersionId()).isEqualTo("v2");
        verify(dataWindow).rebaseReference(trainingData);
    }

    @Test
    void archivedCandidate_keepsReference() {
        policyDecides(DecisionAction.RETRAIN);
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString()))
            .thenReturn(comparison(ModelComparatorService.Verdict.ARCHIVE));

        DecisionRecord record = service.runCycle(CycleTrigger.MANUAL);

        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_ARCHIVED);
        verify(dataWindow, never()).rebaseReference(any());
    }

    @Test
    void retrainAlreadyRunning_isRecordedAsRejected() {
        policyDecides(DecisionAction.RETRAIN);
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.REJECTED, null, RetrainingOrchestrator.REJECTED_IN_PROGRESS, null));

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getAction()).isEqualTo(DecisionAction.RETRAIN);
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.RETRAIN_REJECTED);
        assertThat(record.getReasoning()).contains("another retrain is in progress");
        verifyNoInteractions(comparator);
    }

    @Test
    void guardBlock_downgradesRetrainToAlert() {
        policyDecides(DecisionAction.RETRAIN);
        when(retrainGuard.check()).thenReturn(new RetrainGuard.GuardDecision(false, "3 consecutive candidates were archived"));

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getAction()).isEqualTo(DecisionAction.ALERT);
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.RETRAIN_SUPPRESSED);
        assertThat(record.getReasoning()).contains("Retrain suppressed");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void trainingFailure_adoptsOrchestratorAlert() {
        policyDecides(DecisionAction.RETRAIN);
        DecisionRecord alert = DecisionRecord.builder().cycleId("c").policyUsed("rule-based")
            .action(DecisionAction.ALERT).outcome(CycleOutcome.TRAINING_FAILED).trigger(CycleTrigger.SCHEDULED)
            .reasoning("Training failed: trainer unavailable.").recordedAt(Instant.now()).build();
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.FAILED, null, "trainer unavailable", alert));

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record).isSameAs(alert);
        verify(metricsStore, never()).appendDecision(any());
        verify(sink).notify(alert);
    }

    @Test
    void noProduction_bootstrapsFirstModel() {
        when(registry.currentProduction()).thenReturn(Optional.empty());
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));
        when(comparator.compareAndPromote(eq(candidate), isNull(), eq(0.01), anyString()))
            .thenReturn(new ModelComparatorService.ComparisonResult(ModelComparatorService.Verdict.PROMOTE, "v2", null,
                0.95, 0.0, 0.95, EvaluationSource.TRAINING, null));

        DecisionRecord record = service.runCycle(CycleTrigger.MANUAL);

        assertThat(record.getPolicyUsed()).isEqualTo(MonitoringCycleService.BOOTSTRAP_POLICY);
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_PROMOTED);
        verifyNoInteractions(policy);
    }

    @Test
    void abTestMode_placesCandidateUnderTest() {
        promotionProperties.setMetricSource(PromotionProperties.MetricSource.AB_TEST);
        policyDecides(DecisionAction.RETRAIN);
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_UNDER_TEST);
        verify(trafficRouter).startTest(eq(production), eq(candidate), eq(0.1), anyString());
        verifyNoInteractions(comparator);
    }

    @Test
    void missingBaseline_recordsCycleFailure() {
        when(driftDetector.computeDrift(any(), any())).thenThrow(new NoBaselineException());

        DecisionRecord record = service.runCycle(CycleTrigger.MANUAL);

        assertThat(record.getAction()).isEqualTo(DecisionAction.ALERT);
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CYCLE_FAILED);
        assertThat(record.getPolicyUsed()).isEqualTo(MonitoringCycleService.CYCLE_POLICY);
        assertThat(record.getDriftReportId()).isNull();
    }

    @Test
    void cycleExceedingTimeout_isRecordedOnceAsTimedOut() {
        cycleProperties.setTimeout(Duration.ofMillis(200));
        when(driftDetector.computeDrift(any(), any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return report(0.0);
        });

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CYCLE_TIMED_OUT);
        assertThat(record.getAction()).isEqualTo(DecisionAction.ALERT);
        verify(metricsStore, after(500).times(1)).appendDecision(any());
    }

    @Test
    void operatorTrigger_isNotACycleTrigger() {
        assertThatThrownBy(() -> service.runCycle(CycleTrigger.OPERATOR))
            .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void forceRetrain_whileLockHeld_isRefused() {
        try (RetrainLock.Lease lease = retrainLock.tryAcquire("cycle-a").orElseThrow()) {
            assertThatThrownBy(() -> service.forceRetrain("alice"))
                .isInstanceOf(RetrainInProgressException.class);
        }
        verifyNoInteractions(orchestrator);
    }

    @Test
    void forceRetrain_skipsDriftAndGuardHistory() {
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString()))
            .thenReturn(comparison(ModelComparatorService.Verdict.PROMOTE));

        DecisionRecord record = service.forceRetrain("alice");

        assertThat(record.getTrigger()).isEqualTo(CycleTrigger.OPERATOR);
        assertThat(record.getPolicyUsed()).isEqualTo(MonitoringCycleService.OPERATOR_POLICY);
        assertThat(record.getReasoning()).contains("alice");
        verify(retrainGuard, never()).check();
        verifyNoInteractions(driftDetector);
    }

    @Test
    void abTestWithEnoughOutcomes_promotesAndEndsCycleWithoutDriftCheck() {
        placeCandidateUnderTest();
        when(trafficRouter.snapshot()).thenReturn(Optional.of(abTest(200, Instant.now())));
        when(registry.find("v2")).thenReturn(Optional.of(candidate));
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString()))
            .thenReturn(new ModelComparatorService.ComparisonResult(ModelComparatorService.Verdict.PROMOTE, "v2", "v1",
                0.95, 0.90, 0.05, EvaluationSource.AB_TEST, null));

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(appended).hasSize(2);
        DecisionRecord settlement = appended.get(0);
        assertThat(settlement.getPolicyUsed()).isEqualTo(MonitoringCycleService.AB_TEST_POLICY);
        assertThat(settlement.getTrigger()).isEqualTo(CycleTrigger.POLICY);
        assertThat(settlement.getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_PROMOTED);
        assertThat(settlement.getResultingVersionId()).isEqualTo("v2");
        assertThat(settlement.getReasoning()).contains("enough labelled outcomes");
        assertThat(settlement.getCycleId()).isEqualTo(record.getCycleId());

        assertThat(record).isSameAs(appended.get(1));
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.NO_ACTION);
        assertThat(record.getAction()).isEqualTo(DecisionAction.NO_ACTION);
        assertThat(record.getReasoning()).contains("Reference rebased onto v2");
        verify(dataWindow).rebaseReference(trainingData);
        verifyNoInteractions(driftDetector);
        verify(sink).notify(settlement);
        verify(sink).notify(record);
    }

    @Test
    void expiredAbTest_settlesAndCycleStillMeasuresDrift() {
        promotionProperties.getAbTest().setMaxDuration(Duration.ofHours(24));
        when(trafficRouter.snapshot()).thenReturn(Optional.of(abTest(5, Instant.now().minus(Duration.ofHours(25)))));
        when(registry.find("v2")).thenReturn(Optional.of(candidate));
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString()))
            .thenReturn(comparison(ModelComparatorService.Verdict.ARCHIVE));
        policyDecides(DecisionAction.NO_ACTION);

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(appended).hasSize(2);
        assertThat(appended.get(0).getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_ARCHIVED);
        assertThat(appended.get(0).getReasoning()).contains("maximum test duration reached");
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.NO_ACTION);
        assertThat(record.getDriftReportId()).isNotNull();
        verify(dataWindow, never()).rebaseReference(any());
    }

    @Test
    void abTestStillCollecting_isLeftRunning() {
        when(trafficRouter.snapshot()).thenReturn(Optional.of(abTest(5, Instant.now())));
        policyDecides(DecisionAction.NO_ACTION);

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.NO_ACTION);
        assertThat(appended).containsExactly(record);
        verifyNoInteractions(comparator);
        verify(trafficRouter, never()).conclude();
    }

    @Test
    void abTestWhoseCandidateIsNoLongerPending_isDiscarded() {
        when(trafficRouter.snapshot()).thenReturn(Optional.of(abTest(200, Instant.now())));
        when(registry.find("v2")).thenReturn(Optional.of(version("v2", ModelStage.ARCHIVED, "v1")));
        policyDecides(DecisionAction.NO_ACTION);

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        verify(trafficRouter).conclude();
        verifyNoInteractions(comparator);
        assertThat(appended).containsExactly(record);
        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.NO_ACTION);
    }

    @Test
    void settlementFailure_leavesTestRunningAndCycleContinues() {
        when(trafficRouter.snapshot()).thenReturn(Optional.of(abTest(200, Instant.now())));
        when(registry.find("v2")).thenReturn(Optional.of(candidate));
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString()))
            .thenThrow(new RegistryTransitionConflictException("promotions are halted"));
        policyDecides(DecisionAction.NO_ACTION);

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.NO_ACTION);
        assertThat(record.getDriftReportId()).isNotNull();
        assertThat(appended).containsExactly(record);
        verify(trafficRouter, never()).conclude();
        verify(dataWindow, never()).rebaseReference(any());
    }

    @Test
    void failedDecisionAppend_fallsBackToCycleFailedRecord() {
        policyDecides(DecisionAction.RETRAIN);
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString()))
            .thenReturn(comparison(ModelComparatorService.Verdict.PROMOTE));
        doThrow(new IllegalStateException("Value too long for column REASONING"))
            .doAnswer(inv -> store(inv.getArgument(0)))
            .when(metricsStore).appendDecision(any());

        DecisionRecord record = service.runCycle(CycleTrigger.MANUAL);

        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CYCLE_FAILED);
        assertThat(record.getAction()).isEqualTo(DecisionAction.ALERT);
        assertThat(record.getReasoning())
            .contains("while recording CANDIDATE_PROMOTED for v2")
            .contains("Value too long");
        assertThat(record.getResultingVersionId()).isEqualTo("v2");
        assertThat(appended).containsExactly(record);
        verify(metricsStore, times(2)).appendDecision(any());
        verify(sink).notify(record);
    }

    @Test
    void promotionCompletingAfterTimeout_isStillAppended() {
        cycleProperties.setTimeout(Duration.ofMillis(200));
        policyDecides(DecisionAction.RETRAIN);
        when(orchestrator.triggerRetrain(any())).thenReturn(new RetrainingOrchestrator.RetrainOutcome(
            RetrainingOrchestrator.Status.CANDIDATE, candidate, null, null));
        // a registry write that ignores interruption
        when(comparator.compareAndPromote(eq(candidate), eq(production), eq(0.01), anyString())).thenAnswer(inv -> {
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
            while (System.nanoTime() < until) {
                LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(10));
            }
            return comparison(ModelComparatorService.Verdict.PROMOTE);
        });

        DecisionRecord record = service.runCycle(CycleTrigger.SCHEDULED);

        assertThat(record.getOutcome()).isEqualTo(CycleOutcome.CYCLE_TIMED_OUT);
        verify(metricsStore, timeout(3_000).times(2)).appendDecision(any());
        DecisionRecord late = appended.get(1);
        assertThat(late.getCycleId()).isEqualTo(record.getCycleId());
        assertThat(late.getOutcome()).isEqualTo(CycleOutcome.CANDIDATE_PROMOTED);
        assertThat(late.getResultingVersionId()).isEqualTo("v2");
        assertThat(late.getReasoning()).startsWith("Completed after the cycle had already been recorded as CYCLE_TIMED_OUT.");
        verify(dataWindow).rebaseReference(trainingData);
    }
}
