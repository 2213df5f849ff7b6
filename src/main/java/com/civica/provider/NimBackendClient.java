package com.civica.provider;

import com.civica.config.CivicaProperties;
import com.civica.model.ChatCompletionRequest;
import com.civica.model.ChatCompletionResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * NVIDIA NIM chat completion backend (OpenAI-compatible endpoint).
 *
 * No per-request retries: repeated failures are the circuit breaker's concern.
 */
@Slf4j
public class NimBackendClient implements BackendClient {

    private final WebClient webClient;
    private final CivicaProperties.BackendConfig config;

    public NimBackendClient(WebClient webClient, CivicaProperties.BackendConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public String getName() {
        return "nvidia-nim";
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, String apiKey) {
        String endpoint = config.getBaseUrl() + "/chat/completions";
        log.debug("Forwarding request to {}: model={}", getName(), request.getModel());

        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .timeout(config.getTimeout())
                .doOnError(error -> log.warn("Request to {} failed: {}", getName(), error.toString()));
    }
}
