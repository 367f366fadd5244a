package com.driftops.dto;

import com.driftops.model.RoutingArm;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutingResponse {
    String requestId;
    String versionId;
    RoutingArm arm;
    boolean abTestActive;
}
