package com.driftops.entity;

import com.driftops.model.DriftReport;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Entity
@Immutable
@Table(
    name = "drift_reports",
    indexes = {
        @Index(name = "idx_drift_cycle",    columnList = "cycle_id"),
        @Index(name = "idx_drift_computed", columnList = "computed_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class DriftReportRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "cycle_id", nullable = false, updatable = false, length = 64)
    private String cycleId;

    @Column(name = "vocabulary_drift", nullable = false, updatable = false)
    private double vocabularyDrift;

    @Column(name = "distribution_drift", nullable = false, updatable = false)
    private double distributionDrift;

    @Column(name = "emergent_terms", updatable = false, length = 2048)
    private String emergentTerms;

    @Column(name = "vocabulary_threshold", nullable = false, updatable = false)
    private double vocabularyThreshold;

    @Column(name = "distribution_threshold", nullable = false, updatable = false)
    private double distributionThreshold;

    @Column(name = "drift_detected", nullable = false, updatable = false)
    private boolean driftDetected;

    @Column(name = "reference_messages", updatable = false)
    private int referenceMessages;

    @Column(name = "sample_messages", updatable = false)
    private int sampleMessages;

    @Column(name = "computed_at", nullable = false, updatable = false)
    private Instant computedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public static DriftReportRecord of(String cycleId, DriftReport report) {
        return DriftReportRecord.builder()
            .cycleId(cycleId)
            .vocabularyDrift(report.vocabularyDrift())
            .distributionDrift(report.distributionDrift())
            .emergentTerms(String.join(",", report.emergentTerms()))
            .vocabularyThreshold(report.vocabularyThreshold())
            .distributionThreshold(report.distributionThreshold())
            .driftDetected(report.driftDetected())
            .referenceMessages(report.referenceMessages())
            .sampleMessages(report.sampleMessages())
            .computedAt(report.computedAt())
            .build();
    }

    public List<String> emergentTermList() {
        if (emergentTerms == null || emergentTerms.isBlank()) {
            return List.of();
        }
        return Arrays.asList(emergentTerms.split(","));
    }
}
