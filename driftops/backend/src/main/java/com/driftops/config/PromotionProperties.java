package com.driftops.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "mlops.promotion")
public class PromotionProperties {

    public enum MetricSource { HOLDOUT, AB_TEST }

    /** Candidate accuracy must beat production by at least this much. */
    @Positive
    private double margin = 0.01;

    @NotNull
    private MetricSource metricSource = MetricSource.HOLDOUT;

    @Valid
    private AbTest abTest = new AbTest();

    @Getter
    @Setter
    public static class AbTest {
        /** Share of live traffic routed to the candidate, exclusive bounds (0,1). */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double splitRatio = 0.1;
        @Positive
        private long minLabelledPerArm = 200;
        /** Tests older than this are settled on the held-out set instead. */
        @NotNull
        private Duration maxDuration = Duration.ofHours(24);
    }
}
