package com.driftops.notification;

import com.driftops.entity.DecisionRecord;
import com.driftops.model.DecisionAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(DecisionRecord record) {
        if (record.getAction() == DecisionAction.NO_ACTION) {
            log.info("Cycle outcome | cycleId={} | outcome={} | policy={}",
                record.getCycleId(), record.getOutcome(), record.getPolicyUsed());
        } else {
            log.warn("Cycle outcome | cycleId={} | action={} | outcome={} | version={} | reasoning={}",
                record.getCycleId(), record.getAction(), record.getOutcome(),
                record.getResultingVersionId(), record.getReasoning());
        }
    }
}
