package com.driftops.dto;

import com.driftops.model.EvaluationSource;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EvaluationResponse {
    String cycleId;
    String versionId;
    EvaluationSource source;
    double accuracy;
    double precision;
    double recall;
    double f1;
    long sampleCount;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant evaluatedAt;
}
