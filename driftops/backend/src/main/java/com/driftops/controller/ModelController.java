package com.driftops.controller;

import com.driftops.client.ClassifierApiClient;
import com.driftops.config.OperatorGuardFilter;
import com.driftops.dto.AbTestStatsResponse;
import com.driftops.dto.DecisionRecordResponse;
import com.driftops.dto.ModelTransitionResponse;
import com.driftops.dto.ModelVersionResponse;
import com.driftops.dto.RollbackRequest;
import com.driftops.dto.RoutingResponse;
import com.driftops.exception.ModelVersionNotFoundException;
import com.driftops.model.CycleTrigger;
import com.driftops.service.MetricsStoreService;
import com.driftops.service.ModelRegistryService;
import com.driftops.service.MonitoringCycleService;
import com.driftops.service.RollbackService;
import com.driftops.service.TrafficRouterService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistryService registry;
    private final RollbackService rollbackService;
    private final TrafficRouterService trafficRouter;
    private final MonitoringCycleService cycleService;
    private final ClassifierApiClient classifierApiClient;

    @GetMapping("/models/production")
    public ResponseEntity<ModelVersionResponse> production() {
        return registry.currentProduction()
            .map(ModelRegistryService::toResponse)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ModelVersionNotFoundException("production"));
    }

    @GetMapping("/models/candidate")
    public ResponseEntity<ModelVersionResponse> candidate() {
        return registry.currentCandidate()
            .map(ModelRegistryService::toResponse)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/models/versions")
    public ResponseEntity<Page<ModelVersionResponse>> versions(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {
        return ResponseEntity.ok(registry.versions(PageRequest.of(page, size)));
    }

    @GetMapping("/models/versions/{version}")
    public ResponseEntity<ModelVersionResponse> version(@PathVariable String version) {
        return ResponseEntity.ok(ModelRegistryService.toResponse(registry.get(version)));
    }

    @GetMapping("/models/transitions")
    public ResponseEntity<Page<ModelTransitionResponse>> transitions(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int size) {
        return ResponseEntity.ok(registry.transitions(PageRequest.of(page, size)));
    }

    @PostMapping("/models/rollback")
    public ResponseEntity<ModelVersionResponse> rollback(
            @Valid @RequestBody(required = false) RollbackRequest request,
            HttpServletRequest httpRequest) {
        String requestId = OperatorGuardFilter.resolveRequestId(httpRequest);
        String actor = request != null && request.getRequestedBy() != null && !request.getRequestedBy().isBlank()
            ? request.getRequestedBy()
            : requestId;
        String reason = request != null && request.getReason() != null ? request.getReason() : "operator request";
        log.info("POST /models/rollback | actor={} | requestId={}", actor, requestId);
        RollbackService.RollbackResult result = rollbackService.rollback(CycleTrigger.OPERATOR, reason + " (by " + actor + ")");
        return ResponseEntity.ok(ModelRegistryService.toResponse(result.reinstated()));
    }

    @PostMapping("/models/registry/resume")
    public ResponseEntity<Map<String, Object>> resumePromotions(@RequestParam String operator) {
        log.warn("POST /models/registry/resume | operator={}", operator);
        registry.resumePromotions(operator);
        return ResponseEntity.ok(Map.of("halted", registry.isHalted(), "resumedBy", operator));
    }

    @PostMapping("/models/retrain")
    public ResponseEntity<DecisionRecordResponse> forceRetrain(
            @RequestParam(required = false) String requestedBy, HttpServletRequest httpRequest) {
        String requestId = OperatorGuardFilter.resolveRequestId(httpRequest);
        log.info("POST /models/retrain | requestedBy={} | requestId={}", requestedBy, requestId);
        return ResponseEntity.ok(MetricsStoreService.toResponse(
            cycleService.forceRetrain(requestedBy != null ? requestedBy : requestId)));
    }

    @PostMapping("/routing/{requestId}")
    public ResponseEntity<RoutingResponse> route(@PathVariable String requestId) {
        TrafficRouterService.RoutingDecision decision = trafficRouter.route(requestId);
        return ResponseEntity.ok(RoutingResponse.builder()
            .requestId(requestId)
            .versionId(decision.versionId())
            .arm(decision.arm())
            .abTestActive(trafficRouter.activeTest().isPresent())
            .build());
    }

    @PostMapping("/routing/{requestId}/outcome")
    public ResponseEntity<RoutingResponse> recordOutcome(
            @PathVariable String requestId, @RequestParam boolean correct) {
        return trafficRouter.recordOutcome(requestId, correct)
            .map(d -> ResponseEntity.ok(RoutingResponse.builder()
                .requestId(requestId)
                .versionId(d.versionId())
                .arm(d.arm())
                .abTestActive(true)
                .build()))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED).body(RoutingResponse.builder()
                .requestId(requestId)
                .abTestActive(false)
                .build()));
    }

    @GetMapping("/routing/ab-test")
    public ResponseEntity<AbTestStatsResponse> abTest() {
        return trafficRouter.snapshot()
            .map(TrafficRouterService::toResponse)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/classifier/health")
    public Mono<ResponseEntity<Map<String, Object>>> classifierHealth() {
        return classifierApiClient.isHealthy().map(healthy -> {
            Map<String, Object> body = Map.of("classifierApi", healthy ? "UP" : "DOWN",
                                               "status", healthy ? "ok" : "degraded");
            return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
        });
    }
}
