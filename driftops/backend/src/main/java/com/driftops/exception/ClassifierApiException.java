package com.driftops.exception;

public class ClassifierApiException extends DriftOpsException {
    public ClassifierApiException(String message) {
        super("CLASSIFIER_API_ERROR", message);
    }
    public ClassifierApiException(String message, Throwable cause) {
        super("CLASSIFIER_API_ERROR", message, cause);
    }
}
