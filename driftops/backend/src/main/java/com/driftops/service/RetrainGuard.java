package com.driftops.service;

import com.driftops.config.PolicyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Escalates RETRAIN to ALERT when retraining keeps failing to produce a better model, when
 * the previous retrain started too recently, or while a candidate is still under live test.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainGuard {

    private final PolicyProperties properties;
    private final MetricsStoreService metricsStore;
    private final TrafficRouterService trafficRouter;
    private final Clock clock;

    public record GuardDecision(boolean allowed, String reason) {

        static GuardDecision allow() {
            return new GuardDecision(true, null);
        }

        static GuardDecision block(String reason) {
            return new GuardDecision(false, reason);
        }
    }

    public GuardDecision checkPendingTest() {
        Optional<TrafficRouterService.AbTestConfig> pending = trafficRouter.activeTest();
        return pending.isPresent()
            ? GuardDecision.block("candidate " + pending.get().candidateVersion() + " is still under A/B test")
            : GuardDecision.allow();
    }

    public GuardDecision check() {
        GuardDecision pending = checkPendingTest();
        if (!pending.allowed()) {
            return pending;
        }
        PolicyProperties.Guard guard = properties.getGuard();
        if (!guard.isEnabled()) {
            return GuardDecision.allow();
        }
        int limit = guard.getMaxConsecutiveRejections();
        if (limit > 0) {
            int rejections = metricsStore.consecutiveRejections(limit);
            if (rejections >= limit) {
                return GuardDecision.block(rejections + " consecutive candidates were archived; "
                    + "manual review required before retraining again");
            }
        }
        Duration cooldown = guard.getCooldown();
        if (cooldown != null && !cooldown.isZero()) {
            Optional<Instant> lastStart = metricsStore.lastRetrainStart();
            if (lastStart.isPresent()) {
                Duration elapsed = Duration.between(lastStart.get(), Instant.now(clock));
                if (elapsed.compareTo(cooldown) < 0) {
                    return GuardDecision.block("last retrain started " + elapsed.toMinutes()
                        + " min ago, cooldown is " + cooldown.toMinutes() + " min");
                }
            }
        }
        return GuardDecision.allow();
    }
}
