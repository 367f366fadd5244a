package com.driftops.exception;

public class RetrainInProgressException extends DriftOpsException {
    public RetrainInProgressException(String holder) {
        super("RETRAIN_IN_PROGRESS", "A retraining job is already in flight (held by " + holder + ").");
    }
}
