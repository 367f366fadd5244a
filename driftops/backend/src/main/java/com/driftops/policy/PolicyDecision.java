package com.driftops.policy;

import com.driftops.model.DecisionAction;

public record PolicyDecision(DecisionAction action, String reasoning, String policyName) {
}
