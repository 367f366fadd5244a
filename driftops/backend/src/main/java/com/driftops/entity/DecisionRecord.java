package com.driftops.entity;

import com.driftops.model.CycleOutcome;
import com.driftops.model.CycleTrigger;
import com.driftops.model.DecisionAction;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit trail entry. Written once per cycle (and once per rollback or failed retrain);
 * never updated or deleted.
 */
@Entity
@Immutable
@Table(
    name = "decision_records",
    indexes = {
        @Index(name = "idx_decision_cycle",    columnList = "cycle_id"),
        @Index(name = "idx_decision_recorded", columnList = "recorded_at"),
        @Index(name = "idx_decision_outcome",  columnList = "outcome"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class DecisionRecord {

    public static final int MAX_REASONING_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "cycle_id", nullable = false, updatable = false, length = 64)
    private String cycleId;

    @Column(name = "drift_report_id", updatable = false)
    private UUID driftReportId;

    @Column(name = "policy_used", nullable = false, updatable = false, length = 64)
    private String policyUsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision_action", nullable = false, updatable = false, length = 16)
    private DecisionAction action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private CycleOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "cycle_trigger", nullable = false, updatable = false, length = 16)
    private CycleTrigger trigger;

    @Column(nullable = false, updatable = false, length = MAX_REASONING_LENGTH)
    private String reasoning;

    @Column(name = "resulting_version_id", updatable = false, length = 64)
    private String resultingVersionId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
