package com.driftops.exception;

public class InsufficientDataException extends DriftOpsException {
    public InsufficientDataException(int messages, int required) {
        super("INSUFFICIENT_DATA",
              "Sample holds " + messages + " message(s); at least " + required + " required to compute drift.");
    }
}
