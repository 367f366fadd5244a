package com.driftops.exception;

import lombok.Getter;

@Getter
public abstract class DriftOpsException extends RuntimeException {
    private final String errorCode;
    protected DriftOpsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DriftOpsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
