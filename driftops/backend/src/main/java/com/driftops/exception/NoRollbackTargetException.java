package com.driftops.exception;

public class NoRollbackTargetException extends DriftOpsException {
    public NoRollbackTargetException(String productionId) {
        super("NO_ROLLBACK_TARGET", productionId == null
            ? "There is no production version to roll back from."
            : "No previously promoted version found in the lineage of production version '" + productionId + "'.");
    }
}
