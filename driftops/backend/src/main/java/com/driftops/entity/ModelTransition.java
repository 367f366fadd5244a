package com.driftops.entity;

import com.driftops.model.ModelStage;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(
    name = "model_transitions",
    indexes = {
        @Index(name = "idx_transition_version",  columnList = "version_id"),
        @Index(name = "idx_transition_occurred", columnList = "occurred_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ModelTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "version_id", nullable = false, updatable = false, length = 64)
    private String versionId;

    /** Null when the version was first registered. */
    @Enumerated(EnumType.STRING)
    @Column(name = "from_stage", updatable = false, length = 16)
    private ModelStage fromStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_stage", nullable = false, updatable = false, length = 16)
    private ModelStage toStage;

    @Column(updatable = false, length = 512)
    private String reason;

    @Column(name = "cycle_id", updatable = false, length = 64)
    private String cycleId;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private long sequenceNo;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;
}
