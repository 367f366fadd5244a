package com.driftops.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed API call. {@code code} is the stable machine-readable
 * {@link com.driftops.exception.DriftOpsException#getErrorCode() error code};
 * {@code retryable} tells operators and scripts whether repeating the same call later can
 * succeed without changing anything (classifier outage, retrain already running).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    int     status;
    String  error;
    String  code;
    String  message;
    boolean retryable;
    String  path;
    String  requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
    List<Violation> fieldErrors;

    @Value
    @Builder
    public static class Violation {
        String field;
        Object rejectedValue;
        String message;
    }
}
