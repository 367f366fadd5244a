package com.driftops.policy;

import com.driftops.config.PolicyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class DecisionPolicyRegistry {

    private final Map<PolicyProperties.Mode, DecisionPolicy> policies = new EnumMap<>(PolicyProperties.Mode.class);
    private final PolicyProperties properties;

    public DecisionPolicyRegistry(List<DecisionPolicy> policyList, PolicyProperties properties) {
        this.properties = properties;
        for (DecisionPolicy policy : policyList) {
            DecisionPolicy prev = policies.put(policy.mode(), policy);
            if (prev != null) {
                log.warn("Two decision policies registered for {}: {} and {}; using the latter",
                    policy.mode(), prev.getClass().getSimpleName(), policy.getClass().getSimpleName());
            }
        }
        log.info("Decision policies registered: {} | active={}", policies.keySet(), properties.getMode());
    }

    public DecisionPolicy active() {
        DecisionPolicy policy = policies.get(properties.getMode());
        if (policy == null) {
            policy = policies.get(PolicyProperties.Mode.RULE_BASED);
        }
        if (policy == null) {
            throw new IllegalStateException("No rule-based decision policy registered");
        }
        return policy;
    }
}
