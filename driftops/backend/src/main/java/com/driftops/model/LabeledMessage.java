package com.driftops.model;

/**
 * A single text message. {@code spam} is null for unlabelled live traffic.
 */
public record LabeledMessage(String text, Boolean spam) {

    public boolean isLabelled() {
        return spam != null;
    }
}
