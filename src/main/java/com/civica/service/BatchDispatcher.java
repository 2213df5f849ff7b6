package com.civica.service;

import com.civica.model.ActorSnapshot;
import com.civica.model.AnalysisResult;
import com.civica.model.ChatCompletionRequest;
import com.civica.model.ChatCompletionResponse;
import com.civica.model.RequestType;
import com.civica.provider.BackendClient;
import com.civica.provider.BackendOutcome;
import com.civica.provider.BackendResponseParser;
import com.civica.provider.FailureKind;
import com.civica.provider.PromptBuilder;
import com.civica.security.CredentialProvider;
import com.civica.service.resilience.CircuitBreaker;
import com.civica.service.resilience.ConcurrencyGate;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Sends one representative request to the backend.
 *
 * Order of admission: credential check (never counts against the breaker),
 * circuit breaker, concurrency gate, then the blocking call with its timeout.
 * Every path ends in a {@link BackendOutcome}; nothing is thrown to the caller.
 */
@Slf4j
public class BatchDispatcher {

    private final BackendClient client;
    private final PromptBuilder promptBuilder;
    private final BackendResponseParser parser;
    private final CircuitBreaker circuitBreaker;
    private final ConcurrencyGate gate;
    private final CredentialProvider credentials;
    private final String apiKeyName;
    private final ServiceStatusTracker statusTracker;

    public BatchDispatcher(BackendClient client,
                           PromptBuilder promptBuilder,
                           BackendResponseParser parser,
                           CircuitBreaker circuitBreaker,
                           ConcurrencyGate gate,
                           CredentialProvider credentials,
                           String apiKeyName,
                           ServiceStatusTracker statusTracker) {
        this.client = client;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.circuitBreaker = circuitBreaker;
        this.gate = gate;
        this.credentials = credentials;
        this.apiKeyName = apiKeyName;
        this.statusTracker = statusTracker;
    }

    public BackendOutcome dispatch(ActorSnapshot representative, RequestType type, String subject) {
        Optional<String> apiKey = credentials.getSecret(apiKeyName);
        if (apiKey.isEmpty()) {
            log.warn("No credential '{}' configured, skipping backend call", apiKeyName);
            return BackendOutcome.unavailable(FailureKind.NO_CREDENTIAL, "No credential configured: " + apiKeyName);
        }

        ChatCompletionRequest request = promptBuilder.build(representative, type, subject);
        BackendOutcome outcome = circuitBreaker.execute(() -> callGated(request, apiKey.get(), type));

        switch (outcome.getStatus()) {
            case SUCCESS -> statusTracker.recordSuccess();
            case FAILURE -> statusTracker.recordFailure();
            default -> log.debug("Backend call not attempted: {}", outcome.getFailureKind());
        }
        return outcome;
    }

    private BackendOutcome callGated(ChatCompletionRequest request, String apiKey, RequestType type) {
        try {
            return gate.withPermit(() -> call(request, apiKey, type));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BackendOutcome.unavailable(FailureKind.INTERRUPTED, "Interrupted waiting for a backend slot");
        }
    }

    private BackendOutcome call(ChatCompletionRequest request, String apiKey, RequestType type) {
        try {
            ChatCompletionResponse response = client.complete(request, apiKey).block();
            String content = response == null ? null : response.firstContent();
            AnalysisResult result = parser.parse(type, content);
            return BackendOutcome.success(result);
        } catch (RuntimeException e) {
            FailureKind kind = FailureKind.classify(e);
            log.warn("Backend {} call failed ({}): {}", client.getName(), kind, e.getMessage());
            return BackendOutcome.failure(kind, e.getMessage());
        }
    }

    public boolean hasCredential() {
        return credentials.getSecret(apiKeyName).isPresent();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public ConcurrencyGate getGate() {
        return gate;
    }

    public ServiceStatusTracker getStatusTracker() {
        return statusTracker;
    }
}
