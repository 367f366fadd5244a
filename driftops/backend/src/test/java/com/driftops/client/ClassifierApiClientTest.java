package com.driftops.client;

import com.driftops.exception.ClassifierApiException;
import com.driftops.exception.ClassifierApiUnavailableException;
import com.driftops.model.LabeledMessage;
import com.driftops.model.ModelMetrics;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

class ClassifierApiClientTest {

    private static WireMockServer wireMock;

    private ClassifierApiClient client;

    private final List<LabeledMessage> samples = List.of(
        new LabeledMessage("win a free cruise", true),
        new LabeledMessage("running late, start without me", false));

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        client = new ClassifierApiClient();
        ReflectionTestUtils.setField(client, "baseUrl", wireMock.baseUrl());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 5);
        client.init();
    }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @Test
    void train_parsesArtifactAndMetrics() {
        wireMock.stubFor(post(urlEqualTo("/train"))
            .withHeader("X-Cycle-ID", equalTo("cycle-7"))
            .withRequestBody(matchingJsonPath("$.samples[0].label", equalTo("1")))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"artifact_uri\":\"s3://models/a7\",\"samples\":2,"
                    + "\"metrics\":{\"accuracy\":0.951,\"precision\":0.94,\"recall\":0.9,\"f1\":0.92}}")));

        StepVerifier.create(client.train(samples, "cycle-7"))
            .assertNext(result -> {
                assertThat(result.artifactUri()).isEqualTo("s3://models/a7");
                assertThat(result.samples()).isEqualTo(2);
                assertThat(result.metrics()).isEqualTo(new ModelMetrics(0.951, 0.94, 0.9, 0.92));
            })
            .verifyComplete();
    }

    @Test
    void train_missingArtifact_isClassifierError() {
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"metrics\":{\"accuracy\":0.9}}")));

        StepVerifier.create(client.train(samples, "c"))
            .expectError(ClassifierApiException.class)
            .verify();
    }

    @Test
    void evaluate_serverError_isUnavailable() {
        wireMock.stubFor(post(urlEqualTo("/evaluate")).willReturn(aResponse().withStatus(503).withBody("warming up")));

        StepVerifier.create(client.evaluate("s3://models/a1", samples, "c"))
            .expectError(ClassifierApiUnavailableException.class)
            .verify();
    }

    @Test
    void evaluate_badRequest_isClassifierError() {
        wireMock.stubFor(post(urlEqualTo("/evaluate")).willReturn(aResponse().withStatus(400).withBody("unknown artifact")));

        StepVerifier.create(client.evaluate("s3://models/missing", samples, "c"))
            .expectErrorMatches(ex -> ex instanceof ClassifierApiException && ex.getMessage().contains("unknown artifact"))
            .verify();
    }

    @Test
    void health_falseWhenServiceDown() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(500)));

        StepVerifier.create(client.isHealthy())
            .expectNext(false)
            .verifyComplete();
    }
}
