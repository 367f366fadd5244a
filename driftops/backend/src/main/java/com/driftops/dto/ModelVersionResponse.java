package com.driftops.dto;

import com.driftops.model.ModelStage;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelVersionResponse {
    String id;
    ModelStage stage;
    double accuracy;
    double precision;
    double recall;
    double f1;
    String parentId;
    String artifactUri;
    int trainingSamples;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant promotedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant archivedAt;
}
