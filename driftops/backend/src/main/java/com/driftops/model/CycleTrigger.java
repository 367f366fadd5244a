package com.driftops.model;

public enum CycleTrigger {
    SCHEDULED,
    MANUAL,
    OPERATOR,
    POLICY
}
