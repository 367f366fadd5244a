package com.driftops.exception;

public class IncomparableProfilesException extends DriftOpsException {
    public IncomparableProfilesException(String referenceFingerprint, String sampleFingerprint) {
        super("INCOMPARABLE_PROFILES",
              "Reference profile (" + referenceFingerprint + ") and sample profile (" + sampleFingerprint
                  + ") were built with different feature configurations.");
    }
}
