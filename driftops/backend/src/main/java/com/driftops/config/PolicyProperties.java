package com.driftops.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "mlops.policy")
public class PolicyProperties {

    public enum Mode { RULE_BASED, ADVISORY }

    private Mode mode = Mode.RULE_BASED;

    /** Production accuracy below this triggers a retrain regardless of drift. */
    private double accuracyFloor = 0.93;

    private Advisory advisory = new Advisory();
    private Guard guard = new Guard();

    @Getter
    @Setter
    public static class Advisory {
        private String baseUrl = "http://localhost:8100";
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Guard {
        private boolean enabled = true;
        /** Consecutive archived candidates after which RETRAIN is escalated to ALERT. */
        private int maxConsecutiveRejections = 3;
        /** Minimum pause between two retrain starts. */
        private Duration cooldown = Duration.ofHours(1);
    }
}
