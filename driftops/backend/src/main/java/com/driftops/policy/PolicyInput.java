package com.driftops.policy;

import com.driftops.model.DriftReport;

import java.time.Duration;

/**
 * @param currentAccuracy latest production accuracy, null when no model is serving yet
 * @param sinceLastCheck  time since the previous recorded decision, null on the first cycle
 */
public record PolicyInput(DriftReport report, Double currentAccuracy, Duration sinceLastCheck) {
}
