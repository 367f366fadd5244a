package com.driftops.service;

import com.driftops.dto.DecisionRecordResponse;
import com.driftops.dto.DriftReportResponse;
import com.driftops.dto.EvaluationResponse;
import com.driftops.entity.DecisionRecord;
import com.driftops.entity.DriftReportRecord;
import com.driftops.entity.EvaluationRecord;
import com.driftops.model.CycleOutcome;
import com.driftops.model.DriftReport;
import com.driftops.model.EvaluationSource;
import com.driftops.model.ModelMetrics;
import com.driftops.repository.DecisionRecordRepository;
import com.driftops.repository.DriftReportRepository;
import com.driftops.repository.EvaluationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store for drift reports, evaluations and decisions. Each append commits in
 * its own transaction and writes one complete record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsStoreService {

    private static final EnumSet<CycleOutcome> CANDIDATE_VERDICTS =
        EnumSet.of(CycleOutcome.CANDIDATE_PROMOTED, CycleOutcome.CANDIDATE_ARCHIVED);
    private static final EnumSet<CycleOutcome> RETRAIN_STARTS = EnumSet.of(
        CycleOutcome.CANDIDATE_PROMOTED, CycleOutcome.CANDIDATE_ARCHIVED, CycleOutcome.CANDIDATE_UNDER_TEST,
        CycleOutcome.TRAINING_FAILED, CycleOutcome.TRAINING_CANCELLED, CycleOutcome.EVALUATION_FAILED);

    private final DriftReportRepository driftReportRepository;
    private final DecisionRecordRepository decisionRecordRepository;
    private final EvaluationRecordRepository evaluationRecordRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DriftReportRecord appendDriftReport(String cycleId, DriftReport report) {
        DriftReportRecord saved = driftReportRepository.save(DriftReportRecord.of(cycleId, report));
        log.debug("Drift report appended | id={} | cycleId={}", saved.getId(), cycleId);
        return saved;
    }

    /**
     * Appends a decision. Reasoning longer than the column is cut to fit; the record is
     * always written rather than rejected.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DecisionRecord appendDecision(DecisionRecord.DecisionRecordBuilder builder) {
        DecisionRecord record = builder.recordedAt(Instant.now(clock)).build();
        String reasoning = record.getReasoning();
        if (reasoning != null && reasoning.length() > DecisionRecord.MAX_REASONING_LENGTH) {
            log.warn("Decision reasoning truncated | cycleId={} | length={}", record.getCycleId(), reasoning.length());
            record = builder.reasoning(truncate(reasoning, DecisionRecord.MAX_REASONING_LENGTH)).build();
        }
        DecisionRecord saved = decisionRecordRepository.save(record);
        log.info("Decision appended | id={} | cycleId={} | action={} | outcome={} | version={}",
            saved.getId(), saved.getCycleId(), saved.getAction(), saved.getOutcome(), saved.getResultingVersionId());
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EvaluationRecord appendEvaluation(String cycleId, String versionId, EvaluationSource source,
                                             ModelMetrics metrics, long sampleCount) {
        return evaluationRecordRepository.save(EvaluationRecord.builder()
            .cycleId(cycleId)
            .versionId(versionId)
            .source(source)
            .accuracy(metrics.accuracy())
            .precision(metrics.precision())
            .recall(metrics.recall())
            .f1(metrics.f1())
            .sampleCount(sampleCount)
            .evaluatedAt(Instant.now(clock))
            .build());
    }

    @Transactional(readOnly = true)
    public Optional<DecisionRecord> latestDecision() {
        return decisionRecordRepository.findFirstByOrderByRecordedAtDesc();
    }

    @Transactional(readOnly = true)
    public Optional<Double> latestAccuracy(String versionId) {
        return evaluationRecordRepository.findFirstByVersionIdOrderByEvaluatedAtDesc(versionId)
            .map(EvaluationRecord::getAccuracy);
    }

    /**
     * Number of most recent candidate verdicts that were archives, stopping at the first promotion.
     */
    @Transactional(readOnly = true)
    public int consecutiveRejections(int lookback) {
        List<DecisionRecord> recent = decisionRecordRepository.findRecentByOutcomes(
            CANDIDATE_VERDICTS, PageRequest.of(0, Math.max(1, lookback)));
        int count = 0;
        for (DecisionRecord record : recent) {
            if (record.getOutcome() != CycleOutcome.CANDIDATE_ARCHIVED) {
                break;
            }
            count++;
        }
        return count;
    }

    @Transactional(readOnly = true)
    public Optional<Instant> lastRetrainStart() {
        return decisionRecordRepository.findRecentByOutcomes(RETRAIN_STARTS, PageRequest.of(0, 1)).stream()
            .findFirst()
            .map(DecisionRecord::getRecordedAt);
    }

    @Transactional(readOnly = true)
    public Page<DriftReportResponse> driftHistory(Pageable pageable) {
        return driftReportRepository.findAllByOrderByComputedAtAsc(pageable).map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public Page<DecisionRecordResponse> decisionHistory(Pageable pageable) {
        return decisionRecordRepository.findAllByOrderByRecordedAtAsc(pageable).map(MetricsStoreService::toResponse);
    }

    @Transactional(readOnly = true)
    public Page<EvaluationResponse> evaluationHistory(Pageable pageable) {
        return evaluationRecordRepository.findAllByOrderByEvaluatedAtAsc(pageable).map(e -> EvaluationResponse.builder()
            .cycleId(e.getCycleId())
            .versionId(e.getVersionId())
            .source(e.getSource())
            .accuracy(e.getAccuracy())
            .precision(e.getPrecision())
            .recall(e.getRecall())
            .f1(e.getF1())
            .sampleCount(e.getSampleCount())
            .evaluatedAt(e.getEvaluatedAt())
            .build());
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        String marker = " [truncated]";
        return value.substring(0, max - marker.length()) + marker;
    }

    public static DecisionRecordResponse toResponse(DecisionRecord r) {
        return DecisionRecordResponse.builder()
            .id(r.getId())
            .cycleId(r.getCycleId())
            .driftReportId(r.getDriftReportId())
            .policyUsed(r.getPolicyUsed())
            .action(r.getAction())
            .outcome(r.getOutcome())
            .trigger(r.getTrigger())
            .reasoning(r.getReasoning())
            .resultingVersionId(r.getResultingVersionId())
            .recordedAt(r.getRecordedAt())
            .build();
    }

    private DriftReportResponse toResponse(DriftReportRecord r) {
        return DriftReportResponse.builder()
            .id(r.getId())
            .cycleId(r.getCycleId())
            .vocabularyDrift(r.getVocabularyDrift())
            .distributionDrift(r.getDistributionDrift())
            .emergentTerms(r.emergentTermList())
            .vocabularyThreshold(r.getVocabularyThreshold())
            .distributionThreshold(r.getDistributionThreshold())
            .driftDetected(r.isDriftDetected())
            .referenceMessages(r.getReferenceMessages())
            .sampleMessages(r.getSampleMessages())
            .computedAt(r.getComputedAt())
            .build();
    }
}
