package com.driftops.dto;

import com.driftops.model.CycleOutcome;
import com.driftops.model.CycleTrigger;
import com.driftops.model.DecisionAction;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DecisionRecordResponse {
    UUID id;
    String cycleId;
    UUID driftReportId;
    String policyUsed;
    DecisionAction action;
    CycleOutcome outcome;
    CycleTrigger trigger;
    String reasoning;
    String resultingVersionId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant recordedAt;
}
