package com.driftops.dto;

import com.driftops.model.CycleState;
import com.driftops.model.CycleTrigger;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CycleStateResponse {
    List<RunningCycle> running;
    boolean retrainInProgress;
    String retrainHolder;
    boolean promotionsHalted;
    String haltReason;
    String productionVersion;
    String candidateVersion;
    AbTestStatsResponse abTest;

    @Value
    @Builder
    public static class RunningCycle {
        String cycleId;
        CycleTrigger trigger;
        CycleState state;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant startedAt;
    }
}
