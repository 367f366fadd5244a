package com.driftops.exception;

public class InvalidRequestException extends DriftOpsException {
    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
