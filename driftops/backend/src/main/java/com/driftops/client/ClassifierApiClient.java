package com.driftops.client;

import com.driftops.exception.ClassifierApiException;
import com.driftops.exception.ClassifierApiUnavailableException;
import com.driftops.model.LabeledMessage;
import com.driftops.model.ModelMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client for the external classifier service that trains and evaluates the spam model.
 * The service is a black box: {@code POST /train} returns an artifact URI plus training
 * metrics, {@code POST /evaluate} scores an artifact against labelled samples.
 */
@Slf4j
@Component
public class ClassifierApiClient {

    @Value("${classifier.api.base-url}")
    private String baseUrl;

    @Value("${classifier.api.timeout-seconds:300}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
        log.info("ClassifierApiClient initialised → {}", baseUrl);
    }

    public Mono<TrainResult> train(List<LabeledMessage> samples, String cycleId) {
        ObjectNode body = mapper.createObjectNode();
        body.set("samples", toSamples(samples));
        return webClient.post().uri("/train")
            .header("X-Cycle-ID", cycleId)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new ClassifierApiException("Classifier rejected training request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new ClassifierApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toTrainResult)
            .onErrorMap(WebClientRequestException.class, ClassifierApiUnavailableException::new);
    }

    public Mono<ModelMetrics> evaluate(String artifactUri, List<LabeledMessage> samples, String cycleId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("artifact_uri", artifactUri);
        body.set("samples", toSamples(samples));
        return webClient.post().uri("/evaluate")
            .header("X-Cycle-ID", cycleId)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new ClassifierApiException("Classifier rejected evaluation request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new ClassifierApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toMetrics)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new ClassifierApiUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, ClassifierApiUnavailableException::new);
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> "ok".equals(json.path("status").asText()))
            .onErrorReturn(false);
    }

    private TrainResult toTrainResult(JsonNode json) {
        if (json == null || !json.hasNonNull("artifact_uri")) {
            throw new ClassifierApiException("Classifier response missing 'artifact_uri': " + json);
        }
        JsonNode metrics = json.get("metrics");
        if (metrics == null || metrics.isNull()) {
            throw new ClassifierApiException("Classifier response missing 'metrics': " + json);
        }
        return new TrainResult(json.get("artifact_uri").asText(), toMetrics(metrics), json.path("samples").asInt(0));
    }

    private ModelMetrics toMetrics(JsonNode json) {
        if (json == null || !json.hasNonNull("accuracy")) {
            throw new ClassifierApiException("Classifier response missing 'accuracy': " + json);
        }
        return new ModelMetrics(
            json.get("accuracy").asDouble(),
            json.path("precision").asDouble(0.0),
            json.path("recall").asDouble(0.0),
            json.path("f1").asDouble(0.0));
    }

    private ArrayNode toSamples(List<LabeledMessage> samples) {
        ArrayNode array = mapper.createArrayNode();
        for (LabeledMessage m : samples) {
            ObjectNode node = array.addObject();
            node.put("text", m.text());
            if (m.spam() != null) {
                node.put("label", m.spam() ? 1 : 0);
            }
        }
        return array;
    }

    public record TrainResult(String artifactUri, ModelMetrics metrics, int samples) {}
}
