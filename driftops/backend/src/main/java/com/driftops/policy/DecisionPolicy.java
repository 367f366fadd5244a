package com.driftops.policy;

import com.driftops.config.PolicyProperties;

/**
 * Maps a drift report plus current model quality to RETRAIN, ALERT or NO_ACTION.
 * The rest of the loop never depends on how an implementation reaches its decision.
 */
public interface DecisionPolicy {

    PolicyProperties.Mode mode();

    PolicyDecision decide(PolicyInput input);
}
