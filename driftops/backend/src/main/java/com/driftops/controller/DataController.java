package com.driftops.controller;

import com.driftops.dto.DataProfileResponse;
import com.driftops.dto.MessageBatchRequest;
import com.driftops.exception.InvalidRequestException;
import com.driftops.exception.NoBaselineException;
import com.driftops.model.DataProfile;
import com.driftops.service.DataWindowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/data")
@RequiredArgsConstructor
public class DataController {

    private static final int TOP_TERMS = 25;

    private final DataWindowService dataWindow;

    @PutMapping("/reference")
    public ResponseEntity<DataProfileResponse> registerReference(@Valid @RequestBody MessageBatchRequest request) {
        log.info("PUT /data/reference | messages={}", request.getMessages().size());
        DataProfile profile = dataWindow.registerReference(request.toMessages());
        return ResponseEntity.ok(toResponse("reference", profile, null));
    }

    @PostMapping("/batches")
    public ResponseEntity<Map<String, Object>> ingest(@Valid @RequestBody MessageBatchRequest request) {
        int windowSize = dataWindow.ingest(request.toMessages());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("accepted", request.getMessages().size(), "windowSize", windowSize));
    }

    @PutMapping("/holdout")
    public ResponseEntity<Map<String, Object>> replaceHoldout(@Valid @RequestBody MessageBatchRequest request) {
        dataWindow.replaceHoldout(request.toMessages());
        return ResponseEntity.ok(Map.of("holdoutSize", dataWindow.holdout().size()));
    }

    @GetMapping("/profile")
    public ResponseEntity<DataProfileResponse> profile(@RequestParam(defaultValue = "reference") String kind) {
        return switch (kind) {
            case "reference" -> ResponseEntity.ok(toResponse(kind,
                dataWindow.referenceProfile().orElseThrow(NoBaselineException::new), dataWindow.holdout().size()));
            case "sample" -> ResponseEntity.ok(toResponse(kind, dataWindow.sampleProfile(), null));
            default -> throw new InvalidRequestException("kind must be 'reference' or 'sample'");
        };
    }

    private static DataProfileResponse toResponse(String kind, DataProfile profile, Integer holdoutSize) {
        Map<String, Long> top = new LinkedHashMap<>();
        profile.termCounts().entrySet().stream()
            .limit(TOP_TERMS)
            .forEach(e -> top.put(e.getKey(), e.getValue()));
        return DataProfileResponse.builder()
            .kind(kind)
            .messageCount(profile.messageCount())
            .totalTokens(profile.totalTokens())
            .vocabularySize(profile.vocabulary().size())
            .featureFingerprint(profile.featureFingerprint())
            .topTerms(top)
            .builtAt(profile.builtAt())
            .holdoutSize(holdoutSize)
            .build();
    }
}
