package com.driftops.entity;

import com.driftops.model.ModelMetrics;
import com.driftops.model.ModelStage;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
    name = "model_versions",
    indexes = {
        @Index(name = "idx_model_stage",   columnList = "stage"),
        @Index(name = "idx_model_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelVersion {

    @Id
    @Column(updatable = false, nullable = false, length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ModelStage stage;

    private double accuracy;

    @Column(name = "metric_precision")
    private double precision;

    @Column(name = "metric_recall")
    private double recall;

    private double f1;

    @Column(name = "parent_id", length = 64)
    private String parentId;

    @Column(name = "artifact_uri", length = 512)
    private String artifactUri;

    @Column(name = "training_samples")
    private int trainingSamples;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /** First time this version held PRODUCTION; null for versions that never served. */
    @Column(name = "promoted_at")
    private Instant promotedAt;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @Version
    private Long revision;

    public ModelMetrics metrics() {
        return new ModelMetrics(accuracy, precision, recall, f1);
    }

    public boolean wasEverProduction() {
        return promotedAt != null;
    }
}
