package com.example.proctorstream.store;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

@Component
public class WebClientDownstreamStore implements DownstreamStore {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientDownstreamStore(WebClient.Builder builder,
                                    @Value("${app.downstream.base-url:http://localhost:8000/api/v1}") String baseUrl,
                                    @Value("${app.downstream.api-token:}") String apiToken,
                                    @Value("${app.downstream.timeout-ms:5000}") long timeoutMs) {
        WebClient.Builder b = builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiToken != null && !apiToken.isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken);
        }
        this.webClient = b.build();
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<Void> execute(DownstreamCall call) {
        DownstreamCall.Kind kind = call.getKind();
        WebClient.RequestBodySpec request = kind == DownstreamCall.Kind.LOG_INTERVENTION
                ? webClient.method(kind.getMethod()).uri(kind.getPathTemplate())
                : webClient.method(kind.getMethod()).uri(kind.getPathTemplate(), call.getTargetId());
        return request
                .bodyValue(call.getBody())
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .then();
    }

    @Override
    public Mono<Map<String, Object>> sessionDetails(String sessionId) {
        return webClient.get()
                .uri("/sessions/{id}/details", sessionId)
                .retrieve()
                .bodyToMono(JSON_MAP)
                .timeout(timeout);
    }

    @Override
    public Mono<Map<String, Object>> activeSessions() {
        return webClient.get()
                .uri("/sessions/active")
                .retrieve()
                .bodyToMono(JSON_MAP)
                .timeout(timeout);
    }
}
