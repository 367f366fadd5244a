package com.driftops.model;

import com.driftops.entity.ModelVersion;

import java.time.Instant;

/**
 * Immutable view of a registry entry, safe to hand to concurrent readers.
 */
public record ModelSnapshot(
    String id,
    ModelStage stage,
    ModelMetrics metrics,
    String parentId,
    String artifactUri,
    int trainingSamples,
    Instant createdAt,
    Instant promotedAt,
    Instant archivedAt
) {

    public static ModelSnapshot of(ModelVersion v) {
        return new ModelSnapshot(v.getId(), v.getStage(), v.metrics(), v.getParentId(), v.getArtifactUri(),
            v.getTrainingSamples(), v.getCreatedAt(), v.getPromotedAt(), v.getArchivedAt());
    }

    public double accuracy() {
        return metrics.accuracy();
    }
}
