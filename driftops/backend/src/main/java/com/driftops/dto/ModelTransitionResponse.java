package com.driftops.dto;

import com.driftops.model.ModelStage;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ModelTransitionResponse {
    long sequenceNo;
    String versionId;
    ModelStage fromStage;
    ModelStage toStage;
    String reason;
    String cycleId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant occurredAt;
}
