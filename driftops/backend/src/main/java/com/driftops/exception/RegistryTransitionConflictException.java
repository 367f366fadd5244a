package com.driftops.exception;

public class RegistryTransitionConflictException extends DriftOpsException {
    public RegistryTransitionConflictException(String message) {
        super("REGISTRY_TRANSITION_CONFLICT", message);
    }
}
