package com.driftops.controller;

import com.driftops.service.ModelRegistryService;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class DriftOpsIntegrationTest {

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate restTemplate;
    @Autowired ModelRegistryService registry;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9090));
        wireMock.start();
        WireMock.configureFor("localhost", 9090);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    private static Map<String, Object> msg(String text, boolean spam) {
        return Map.of("text", text, "spam", spam);
    }

    private static Map<String, Object> batch(List<Map<String, Object>> messages) {
        return Map.of("messages", messages);
    }

    private static List<Map<String, Object>> everydayMessages() {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            messages.add(msg("free entry win cash prize call now", true));
            messages.add(msg("are we still meeting for lunch later", false));
            messages.add(msg("call me when you get home tonight", false));
        }
        return messages;
    }

    private static List<Map<String, Object>> cryptoMessages() {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            messages.add(msg("claim crypto airdrop connect wallet blockchain token", true));
            messages.add(msg("nft mint live stake crypto rewards", true));
            messages.add(msg("did you move funds into that wallet", false));
        }
        return messages;
    }

    private void stubTrain(String artifactUri, double accuracy) {
        stubFor(post(urlEqualTo("/train")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"artifact_uri\": \"" + artifactUri + "\", \"samples\": 30, \"metrics\": "
                + metricsJson(accuracy) + "}")));
    }

    private void stubEvaluate(String artifactUri, double accuracy) {
        stubFor(post(urlEqualTo("/evaluate"))
            .withRequestBody(matchingJsonPath("$.artifact_uri", equalTo(artifactUri)))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody(metricsJson(accuracy))));
    }

    private static String metricsJson(double accuracy) {
        return "{\"accuracy\": " + accuracy + ", \"precision\": 0.9, \"recall\": 0.88, \"f1\": 0.89}";
    }

    private ResponseEntity<Map> put(String path, Object body) {
        return restTemplate.exchange(path, HttpMethod.PUT, new HttpEntity<>(body), Map.class);
    }

    @Test
    void lifecycle_bootstrapDriftPromotionAndRollback() {
        assertThat(put("/api/v1/data/reference", batch(everydayMessages())).getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(put("/api/v1/data/holdout", batch(List.of(
            msg("win a free prize now", true),
            msg("lunch at noon?", false),
            msg("your crypto wallet reward is waiting", true)))).getStatusCode()).isEqualTo(HttpStatus.OK);
        ResponseEntity<Map> ingested = restTemplate.postForEntity("/api/v1/data/batches",
            batch(everydayMessages()), Map.class);
        assertThat(ingested.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        // no production yet: the first cycle trains and promotes v1
        stubTrain("s3://models/a1", 0.94);
        stubEvaluate("s3://models/a1", 0.94);
        ResponseEntity<Map> first = restTemplate.postForEntity("/api/v1/cycles", null, Map.class);
        assertThat(first.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(first.getBody().get("policyUsed")).isEqualTo("bootstrap");
        assertThat(first.getBody().get("outcome")).isEqualTo("CANDIDATE_PROMOTED");
        assertThat(first.getBody().get("resultingVersionId")).isEqualTo("v1");

        ResponseEntity<Map> production = restTemplate.getForEntity("/api/v1/models/production", Map.class);
        assertThat(production.getBody().get("id")).isEqualTo("v1");
        assertThat(production.getBody().get("stage")).isEqualTo("PRODUCTION");

        // vocabulary shift towards crypto spam drives a retrain with a better candidate
        restTemplate.postForEntity("/api/v1/data/batches", batch(cryptoMessages()), Map.class);
        wireMock.resetAll();
        stubTrain("s3://models/a2", 0.97);
        stubEvaluate("s3://models/a2", 0.97);
        stubEvaluate("s3://models/a1", 0.94);
        ResponseEntity<Map> second = restTemplate.postForEntity("/api/v1/cycles", null, Map.class);
        assertThat(second.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(second.getBody().get("action")).isEqualTo("RETRAIN");
        assertThat(second.getBody().get("outcome")).isEqualTo("CANDIDATE_PROMOTED");
        assertThat(second.getBody().get("resultingVersionId")).isEqualTo("v2");
        assertThat((String) second.getBody().get("reasoning")).contains("crypto");

        ResponseEntity<Map> promoted = restTemplate.getForEntity("/api/v1/models/versions/v2", Map.class);
        assertThat(promoted.getBody().get("stage")).isEqualTo("PRODUCTION");
        assertThat(promoted.getBody().get("parentId")).isEqualTo("v1");

        ResponseEntity<Map> reports = restTemplate.getForEntity("/api/v1/drift/reports", Map.class);
        assertThat(((Number) reports.getBody().get("totalElements")).intValue()).isEqualTo(2);

        // operator rollback reinstates v1
        ResponseEntity<Map> rolledBack = restTemplate.postForEntity("/api/v1/models/rollback",
            Map.of("requestedBy", "oncall", "reason", "false positives reported"), Map.class);
        assertThat(rolledBack.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(rolledBack.getBody().get("id")).isEqualTo("v1");
        assertThat(restTemplate.getForEntity("/api/v1/models/production", Map.class).getBody().get("id"))
            .isEqualTo("v1");
        assertThat(restTemplate.getForEntity("/api/v1/models/versions/v2", Map.class).getBody().get("stage"))
            .isEqualTo("ARCHIVED");

        ResponseEntity<Map> decisions = restTemplate.getForEntity("/api/v1/decisions?size=50", Map.class);
        List<Map<String, Object>> content = (List<Map<String, Object>>) decisions.getBody().get("content");
        assertThat(content).extracting(d -> d.get("outcome")).contains("ROLLED_BACK", "CANDIDATE_PROMOTED");

        // v1 has no earlier production ancestor
        ResponseEntity<Map> noTarget = restTemplate.postForEntity("/api/v1/models/rollback", null, Map.class);
        assertThat(noTarget.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(noTarget.getBody().get("code")).isEqualTo("NO_ROLLBACK_TARGET");

        assertThat(registry.maxConcurrentProductionInHistory()).isLessThanOrEqualTo(1);
        assertThat(registry.isHalted()).isFalse();

        ResponseEntity<Map> transitions = restTemplate.getForEntity("/api/v1/models/transitions", Map.class);
        assertThat(((Number) transitions.getBody().get("totalElements")).intValue()).isGreaterThanOrEqualTo(5);
    }

    @Test
    void unknownVersion_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/versions/v999", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).containsKeys("code", "message", "requestId");
    }

    @Test
    void emptyBatch_returns422WithFieldErrors() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/data/batches", batch(List.of()), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void blankMessageText_returns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/data/batches",
            batch(List.of(Map.of("text", " "))), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void malformedJobId_returns400_unknownJob_returns404() {
        assertThat(restTemplate.getForEntity("/api/v1/jobs/not-a-uuid", Map.class).getStatusCode())
            .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(restTemplate.getForEntity("/api/v1/jobs/00000000-0000-0000-0000-000000000000", Map.class)
            .getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void cycleState_echoesRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");
        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/cycles/state", HttpMethod.GET,
            new HttpEntity<>(headers), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
        assertThat(resp.getBody()).containsKeys("running", "retrainInProgress", "promotionsHalted");
    }

    @Test
    void routingWithoutTest_isAcceptedButNotCounted() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/routing/req-1/outcome?correct=true",
            null, Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(resp.getBody().get("abTestActive")).isEqualTo(false);
    }

    @Test
    void classifierHealth_reportsUpAndDown() {
        stubFor(get(urlEqualTo("/health")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"status\":\"ok\"}")));
        ResponseEntity<Map> up = restTemplate.getForEntity("/api/v1/classifier/health", Map.class);
        assertThat(up.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(up.getBody().get("classifierApi")).isEqualTo("UP");

        wireMock.resetAll();
        stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(500)));
        ResponseEntity<Map> down = restTemplate.getForEntity("/api/v1/classifier/health", Map.class);
        assertThat(down.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
