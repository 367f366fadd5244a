package com.driftops.entity;

import com.driftops.model.EvaluationSource;
import com.driftops.model.ModelMetrics;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(
    name = "evaluation_records",
    indexes = {
        @Index(name = "idx_eval_version",   columnList = "version_id"),
        @Index(name = "idx_eval_evaluated", columnList = "evaluated_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class EvaluationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "cycle_id", updatable = false, length = 64)
    private String cycleId;

    @Column(name = "version_id", nullable = false, updatable = false, length = 64)
    private String versionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private EvaluationSource source;

    @Column(updatable = false)
    private double accuracy;

    @Column(name = "metric_precision", updatable = false)
    private double precision;

    @Column(name = "metric_recall", updatable = false)
    private double recall;

    @Column(updatable = false)
    private double f1;

    @Column(name = "sample_count", updatable = false)
    private long sampleCount;

    @Column(name = "evaluated_at", nullable = false, updatable = false)
    private Instant evaluatedAt;

    public ModelMetrics metrics() {
        return new ModelMetrics(accuracy, precision, recall, f1);
    }
}
