package com.driftops.service;

import com.driftops.entity.DecisionRecord;
import com.driftops.model.CycleOutcome;
import com.driftops.model.CycleTrigger;
import com.driftops.model.DecisionAction;
import com.driftops.repository.DecisionRecordRepository;
import com.driftops.repository.DriftReportRepository;
import com.driftops.repository.EvaluationRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
class MetricsStoreServiceTest {

    @Autowired DriftReportRepository driftReportRepository;
    @Autowired DecisionRecordRepository decisionRecordRepository;
    @Autowired EvaluationRecordRepository evaluationRecordRepository;

    private MetricsStoreService store;

    @BeforeEach
    void setUp() {
        store = new MetricsStoreService(driftReportRepository, decisionRecordRepository,
            evaluationRecordRepository, Clock.systemUTC());
    }

    private static DecisionRecord.DecisionRecordBuilder decision(String cycleId, String reasoning) {
        return DecisionRecord.builder()
            .cycleId(cycleId)
            .policyUsed("advisory")
            .action(DecisionAction.RETRAIN)
            .outcome(CycleOutcome.CANDIDATE_PROMOTED)
            .trigger(CycleTrigger.SCHEDULED)
            .reasoning(reasoning)
            .resultingVersionId("v2");
    }

    @Test
    void oversizedReasoning_isTruncatedAndStillWritten() {
        String reasoning = "crypto ".repeat(700);

        DecisionRecord saved = store.appendDecision(decision("c-long", reasoning));
        decisionRecordRepository.flush();

        List<DecisionRecord> stored = decisionRecordRepository.findByCycleIdOrderByRecordedAtAsc("c-long");
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getId()).isEqualTo(saved.getId());
        assertThat(stored.get(0).getReasoning())
            .hasSize(DecisionRecord.MAX_REASONING_LENGTH)
            .startsWith("crypto crypto")
            .endsWith("[truncated]");
        assertThat(stored.get(0).getResultingVersionId()).isEqualTo("v2");
    }

    @Test
    void reasoningAtTheLimit_isKeptVerbatim() {
        String reasoning = "x".repeat(DecisionRecord.MAX_REASONING_LENGTH);

        store.appendDecision(decision("c-exact", reasoning));
        decisionRecordRepository.flush();

        assertThat(decisionRecordRepository.findByCycleIdOrderByRecordedAtAsc("c-exact"))
            .singleElement()
            .extracting(DecisionRecord::getReasoning)
            .isEqualTo(reasoning);
    }
}
