package com.driftops.controller;

import com.driftops.config.OperatorGuardFilter;
import com.driftops.dto.AsyncJobResponse;
import com.driftops.dto.CycleStateResponse;
import com.driftops.dto.DecisionRecordResponse;
import com.driftops.dto.DriftReportResponse;
import com.driftops.dto.EvaluationResponse;
import com.driftops.model.CycleTrigger;
import com.driftops.service.AsyncJobService;
import com.driftops.service.MetricsStoreService;
import com.driftops.service.MonitoringCycleService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitoringController {

    private final MonitoringCycleService cycleService;
    private final MetricsStoreService metricsStore;
    private final AsyncJobService asyncJobService;

    @PostMapping("/cycles")
    public ResponseEntity<DecisionRecordResponse> runCycle(HttpServletRequest httpRequest) {
        String requestId = OperatorGuardFilter.resolveRequestId(httpRequest);
        log.info("POST /cycles | requestId={}", requestId);
        return ResponseEntity.ok(MetricsStoreService.toResponse(cycleService.runCycle(CycleTrigger.MANUAL)));
    }

    @PostMapping("/cycles/async")
    public ResponseEntity<AsyncJobResponse> runCycleAsync(HttpServletRequest httpRequest) {
        String requestId = OperatorGuardFilter.resolveRequestId(httpRequest);
        UUID jobId = asyncJobService.submit(
            "MONITORING_CYCLE",
            requestId,
            () -> MetricsStoreService.toResponse(cycleService.runCycle(CycleTrigger.MANUAL))
        );
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/cycles/state")
    public ResponseEntity<CycleStateResponse> cycleState() {
        return ResponseEntity.ok(cycleService.state());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> cancelJob(@PathVariable UUID jobId) {
        log.info("DELETE /jobs/{}", jobId);
        return ResponseEntity.ok(asyncJobService.cancel(jobId));
    }

    @GetMapping("/drift/reports")
    public ResponseEntity<Page<DriftReportResponse>> driftReports(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {
        return ResponseEntity.ok(metricsStore.driftHistory(PageRequest.of(page, size)));
    }

    @GetMapping("/decisions")
    public ResponseEntity<Page<DecisionRecordResponse>> decisions(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {
        return ResponseEntity.ok(metricsStore.decisionHistory(PageRequest.of(page, size)));
    }

    @GetMapping("/evaluations")
    public ResponseEntity<Page<EvaluationResponse>> evaluations(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {
        return ResponseEntity.ok(metricsStore.evaluationHistory(PageRequest.of(page, size)));
    }
}
