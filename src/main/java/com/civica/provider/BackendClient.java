package com.civica.provider;

import com.civica.model.ChatCompletionRequest;
import com.civica.model.ChatCompletionResponse;
import reactor.core.publisher.Mono;

/**
 * Interface for the generative-analysis backend.
 * Implementations handle the wire protocol and authentication.
 */
public interface BackendClient {

    /**
     * Get backend name (e.g., "nvidia-nim").
     *
     * @return backend name
     */
    String getName();

    /**
     * Complete a chat request.
     *
     * @param request OpenAI-compatible request
     * @param apiKey  bearer token for this attempt
     * @return backend response; errors surface as non-2xx or transport failures
     */
    Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, String apiKey);
}
