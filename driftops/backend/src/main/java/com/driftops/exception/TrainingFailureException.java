package com.driftops.exception;

public class TrainingFailureException extends DriftOpsException {
    public TrainingFailureException(String message) {
        super("TRAINING_FAILURE", message);
    }
    public TrainingFailureException(String message, Throwable cause) {
        super("TRAINING_FAILURE", message, cause);
    }
}
