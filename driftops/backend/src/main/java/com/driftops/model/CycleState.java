package com.driftops.model;

/** IDLE → DRIFT_COMPUTED → DECIDED → (RETRAINING → COMPARED)? → RECORDED → IDLE */
public enum CycleState {
    IDLE,
    DRIFT_COMPUTED,
    DECIDED,
    RETRAINING,
    COMPARED,
    RECORDED
}
