package com.driftops.dto;

import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RollbackRequest {
    @Size(max = 64, message = "requestedBy must be at most 64 characters")
    String requestedBy;

    @Size(max = 1000, message = "reason must be at most 1000 characters")
    String reason;
}
