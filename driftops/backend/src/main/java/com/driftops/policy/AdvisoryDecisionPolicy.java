package com.driftops.policy;

import com.driftops.client.AdvisoryApiClient;
import com.driftops.config.PolicyProperties;
import com.driftops.model.DecisionAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Asks the external reasoning service for a decision. The call is bounded by
 * {@code mlops.policy.advisory.timeout}; any failure falls back to the rule-based result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdvisoryDecisionPolicy implements DecisionPolicy {

    public static final String NAME = "advisory";
    public static final String FALLBACK_NAME = "advisory-fallback:" + RuleBasedDecisionPolicy.NAME;

    private final AdvisoryApiClient advisoryApiClient;
    private final RuleBasedDecisionPolicy ruleBased;
    private final PolicyProperties properties;

    @Override
    public PolicyProperties.Mode mode() {
        return PolicyProperties.Mode.ADVISORY;
    }

    @Override
    public PolicyDecision decide(PolicyInput input) {
        Duration timeout = properties.getAdvisory().getTimeout();
        try {
            AdvisoryApiClient.Advice advice = advisoryApiClient
                .advise(input.report(), input.currentAccuracy(), input.sinceLastCheck())
                .timeout(timeout)
                .block();
            if (advice == null || advice.action() == null) {
                return fallback(input, "empty advisory response");
            }
            DecisionAction action = DecisionAction.valueOf(advice.action().trim().toUpperCase(Locale.ROOT));
            String reasoning = advice.reasoning() == null || advice.reasoning().isBlank()
                ? "Advisory service returned " + action + " without reasoning" : advice.reasoning();
            return new PolicyDecision(action, reasoning, NAME);
        } catch (IllegalArgumentException ex) {
            return fallback(input, "unrecognised advisory action");
        } catch (RuntimeException ex) {
            return fallback(input, ex.getClass().getSimpleName()
                + (ex.getMessage() != null ? ": " + ex.getMessage() : ""));
        }
    }

    private PolicyDecision fallback(PolicyInput input, String cause) {
        log.warn("Advisory policy unavailable, falling back to rule-based | cause={}", cause);
        PolicyDecision decision = ruleBased.decide(input);
        return new PolicyDecision(decision.action(),
            "Advisory policy unavailable (" + cause + "); rule-based decision used. " + decision.reasoning(),
            FALLBACK_NAME);
    }
}
