package com.driftops.client;

import com.driftops.config.PolicyProperties;
import com.driftops.model.DriftReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the external reasoning service backing the advisory policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdvisoryApiClient {

    private final PolicyProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();
    private WebClient webClient;

    @PostConstruct
    void init() {
        this.webClient = WebClient.builder()
            .baseUrl(properties.getAdvisory().getBaseUrl())
            .defaultHeader("Content-Type", "application/json")
            .build();
    }

    public Mono<Advice> advise(DriftReport report, Double accuracy, Duration sinceLastCheck) {
        ObjectNode body = mapper.createObjectNode();
        body.put("vocabulary_drift", report.vocabularyDrift());
        body.put("distribution_drift", report.distributionDrift());
        body.put("drift_detected", report.driftDetected());
        body.set("emergent_terms", mapper.valueToTree(report.emergentTerms()));
        if (accuracy != null) {
            body.put("accuracy", accuracy);
        }
        if (sinceLastCheck != null) {
            body.put("since_last_check_seconds", sinceLastCheck.toSeconds());
        }
        return webClient.post().uri("/advise")
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> new Advice(json.path("action").asText(null), json.path("reasoning").asText("")));
    }

    public record Advice(String action, String reasoning) {}
}
