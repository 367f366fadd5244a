package com.driftops.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "mlops.cycle")
public class CycleProperties {

    /** A cycle running longer than this is cancelled and recorded as timed out. */
    private Duration timeout = Duration.ofMinutes(10);

    private Duration trainingTimeout = Duration.ofMinutes(5);

    private Duration evaluationTimeout = Duration.ofMinutes(2);

    private int workerThreads = 2;
}
