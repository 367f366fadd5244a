package com.driftops.service;

import com.driftops.entity.DecisionRecord;
import com.driftops.exception.InvalidRequestException;
import com.driftops.exception.NoRollbackTargetException;
import com.driftops.model.CycleOutcome;
import com.driftops.model.CycleTrigger;
import com.driftops.model.DecisionAction;
import com.driftops.model.ModelSnapshot;
import com.driftops.model.ModelStage;
import com.driftops.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RollbackService {

    public static final String POLICY_NAME = "rollback";

    private final ModelRegistryService registry;
    private final TrafficRouterService trafficRouter;
    private final MetricsStoreService metricsStore;
    private final NotificationDispatcher notifications;

    public record RollbackResult(ModelSnapshot reinstated, String replacedVersionId, DecisionRecord record) {}

    /**
     * Reinstates the nearest ancestor of the current production version that is ARCHIVED and
     * once served production.
     */
    public RollbackResult rollback(CycleTrigger initiator, String reason) {
        if (initiator != CycleTrigger.OPERATOR && initiator != CycleTrigger.POLICY) {
            throw new InvalidRequestException("Rollback must be initiated by OPERATOR or POLICY, got " + initiator);
        }
        ModelSnapshot current = registry.currentProduction()
            .orElseThrow(() -> new NoRollbackTargetException(null));
        ModelSnapshot target = findTarget(current)
            .orElseThrow(() -> new NoRollbackTargetException(current.id()));

        String cycleId = "rollback-" + UUID.randomUUID();
        String why = reason == null || reason.isBlank() ? "no reason given" : reason;
        log.warn("Rollback | from={} | to={} | initiator={} | reason={}", current.id(), target.id(), initiator, why);

        // a test against the outgoing production version is meaningless once it is replaced
        trafficRouter.conclude();
        registry.currentCandidate().ifPresent(c ->
            registry.archiveCandidate(c.id(), "abandoned by rollback to " + target.id(), cycleId));

        ModelSnapshot reinstated = registry.reinstate(target.id(), "rollback: " + why, cycleId);
        DecisionRecord record = metricsStore.appendDecision(DecisionRecord.builder()
            .cycleId(cycleId)
            .policyUsed(POLICY_NAME)
            .action(DecisionAction.ALERT)
            .outcome(CycleOutcome.ROLLED_BACK)
            .trigger(initiator)
            .reasoning("Rolled back production from " + current.id() + " to " + target.id() + ": " + why + ".")
            .resultingVersionId(reinstated.id()));
        notifications.dispatch(record);
        return new RollbackResult(reinstated, current.id(), record);
    }

    private Optional<ModelSnapshot> findTarget(ModelSnapshot current) {
        Set<String> visited = new HashSet<>();
        visited.add(current.id());
        String next = current.parentId();
        while (next != null && visited.add(next)) {
            Optional<ModelSnapshot> ancestor = registry.find(next);
            if (ancestor.isEmpty()) {
                return Optional.empty();
            }
            ModelSnapshot version = ancestor.get();
            if (version.stage() == ModelStage.ARCHIVED && version.promotedAt() != null) {
                return Optional.of(version);
            }
            next = version.parentId();
        }
        return Optional.empty();
    }
}
