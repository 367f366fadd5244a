package com.driftops.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataProfileResponse {
    String kind;
    int messageCount;
    long totalTokens;
    int vocabularySize;
    String featureFingerprint;
    Map<String, Long> topTerms;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant builtAt;
    Integer holdoutSize;
}
