package com.driftops.model;

public enum CycleOutcome {
    NO_ACTION,
    ALERTED,
    RETRAIN_SUPPRESSED,
    RETRAIN_REJECTED,
    CANDIDATE_PROMOTED,
    CANDIDATE_ARCHIVED,
    CANDIDATE_UNDER_TEST,
    TRAINING_FAILED,
    TRAINING_CANCELLED,
    EVALUATION_FAILED,
    ROLLED_BACK,
    CYCLE_FAILED,
    CYCLE_TIMED_OUT
}
