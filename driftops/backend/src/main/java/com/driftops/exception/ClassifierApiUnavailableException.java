package com.driftops.exception;

public class ClassifierApiUnavailableException extends DriftOpsException {
    public ClassifierApiUnavailableException(Throwable cause) {
        super("CLASSIFIER_API_UNAVAILABLE",
              "The classifier training service is currently unavailable. Please try again later.",
              cause);
    }
}
