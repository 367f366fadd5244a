package com.driftops.service;

import com.driftops.entity.DecisionRecord;
import com.driftops.model.CycleTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MonitoringScheduler {

    private final MonitoringCycleService cycleService;

    @Value("${mlops.cycle.scheduler-enabled:true}")
    private boolean enabled;

    @Scheduled(initialDelayString = "${mlops.cycle.initial-delay-ms:60000}",
               fixedDelayString = "${mlops.cycle.fixed-delay-ms:300000}")
    public void tick() {
        if (!enabled) {
            return;
        }
        try {
            DecisionRecord record = cycleService.runCycle(CycleTrigger.SCHEDULED);
            log.debug("Scheduled cycle done | cycleId={} | outcome={}", record.getCycleId(), record.getOutcome());
        } catch (RuntimeException ex) {
            log.error("Scheduled cycle failed", ex);
        }
    }
}
