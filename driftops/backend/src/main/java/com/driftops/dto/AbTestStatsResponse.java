package com.driftops.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AbTestStatsResponse {
    String productionVersion;
    String candidateVersion;
    double splitRatio;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    Arm production;
    Arm candidate;

    @Value
    @Builder
    public static class Arm {
        long routed;
        long labelled;
        long correct;
        double accuracy;
    }
}
