package com.driftops.notification;

import com.driftops.entity.DecisionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans a record out to every sink. A failing sink is logged and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final List<NotificationSink> sinks;

    public void dispatch(DecisionRecord record) {
        for (NotificationSink sink : sinks) {
            try {
                sink.notify(record);
            } catch (RuntimeException ex) {
                log.warn("Notification failed | sink={} | cycleId={} | error={}",
                    sink.name(), record.getCycleId(), ex.getMessage());
            }
        }
    }
}
