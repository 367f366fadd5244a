package com.driftops.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DriftReportResponse {
    UUID id;
    String cycleId;
    double vocabularyDrift;
    double distributionDrift;
    List<String> emergentTerms;
    double vocabularyThreshold;
    double distributionThreshold;
    boolean driftDetected;
    int referenceMessages;
    int sampleMessages;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant computedAt;
}
