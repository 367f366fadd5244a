package com.driftops.exception;

public class ModelVersionNotFoundException extends DriftOpsException {
    public ModelVersionNotFoundException(String id) {
        super("MODEL_VERSION_NOT_FOUND", "Model version '" + id + "' not found.");
    }
}
