package com.driftops.model;

public enum DecisionAction {
    RETRAIN,
    ALERT,
    NO_ACTION
}
