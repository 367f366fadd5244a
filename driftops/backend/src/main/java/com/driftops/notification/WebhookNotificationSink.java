package com.driftops.notification;

import com.driftops.entity.DecisionRecord;
import com.driftops.model.DecisionAction;
import com.driftops.service.MetricsStoreService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Posts decision records as JSON to a configured webhook. Disabled unless
 * {@code notifications.webhook.enabled=true}; NO_ACTION cycles are skipped.
 */
@Slf4j
@Component
public class WebhookNotificationSink implements NotificationSink {

    @Value("${notifications.webhook.enabled:false}")
    private boolean enabled;

    @Value("${notifications.webhook.url:}")
    private String url;

    @Value("${notifications.webhook.timeout-seconds:5}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        if (enabled && (url == null || url.isBlank())) {
            log.warn("Webhook notifications enabled without notifications.webhook.url, disabling");
            enabled = false;
        }
        if (enabled) {
            webClient = WebClient.builder().baseUrl(url).defaultHeader("Content-Type", "application/json").build();
            log.info("WebhookNotificationSink initialised → {}", url);
        }
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void notify(DecisionRecord record) {
        if (!enabled || record.getAction() == DecisionAction.NO_ACTION) {
            return;
        }
        webClient.post()
            .bodyValue(MetricsStoreService.toResponse(record))
            .retrieve()
            .toBodilessEntity()
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .subscribe(
                resp -> log.debug("Webhook delivered | cycleId={} | status={}", record.getCycleId(), resp.getStatusCode()),
                err -> log.warn("Webhook delivery failed | cycleId={} | error={}", record.getCycleId(), err.getMessage()));
    }
}
