package com.driftops.notification;

import com.driftops.entity.DecisionRecord;

/**
 * Destination for terminal cycle outcomes. Implementations may throw; the dispatcher
 * isolates failures from the control loop.
 */
public interface NotificationSink {

    String name();

    void notify(DecisionRecord record);
}
