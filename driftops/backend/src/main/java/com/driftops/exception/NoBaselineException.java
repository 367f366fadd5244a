package com.driftops.exception;

public class NoBaselineException extends DriftOpsException {
    public NoBaselineException() {
        super("NO_BASELINE", "No reference profile has been registered; upload a reference corpus first.");
    }
}
