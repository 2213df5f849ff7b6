package com.civica.config;

import com.civica.events.AnalysisEventSink;
import com.civica.events.SpringAnalysisEventSink;
import com.civica.provider.BackendClient;
import com.civica.provider.BackendResponseParser;
import com.civica.provider.NimBackendClient;
import com.civica.provider.PromptBuilder;
import com.civica.security.CredentialProvider;
import com.civica.security.EnvironmentCredentialProvider;
import com.civica.service.BatchDispatcher;
import com.civica.service.ResponseCacheService;
import com.civica.service.ServiceStatusTracker;
import com.civica.service.SimulationAiGateway;
import com.civica.service.batching.ClusteringBatcher;
import com.civica.service.batching.ResponseCustomizer;
import com.civica.service.canonicalization.RequestKeyGenerator;
import com.civica.service.offline.OfflineAnalysisService;
import com.civica.service.offline.OfflineResponseGenerator;
import com.civica.service.resilience.CircuitBreaker;
import com.civica.service.resilience.ConcurrencyGate;
import com.civica.service.similarity.SimilarityMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.Random;

/**
 * Wires the gateway components from {@link CivicaProperties}.
 */
@Slf4j
@Configuration
public class GatewayConfiguration {

    private static final int DISPATCH_QUEUE_CAPACITY = 1000;

    private final CivicaProperties properties;

    public GatewayConfiguration(CivicaProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResponseCacheService responseCacheService(Clock clock) {
        return new ResponseCacheService(properties.getCache(), clock);
    }

    @Bean
    public ClusteringBatcher clusteringBatcher(Clock clock) {
        return new ClusteringBatcher(properties.getBatching(), new SimilarityMetrics(properties.getSimilarity()), clock);
    }

    @Bean
    public CircuitBreaker backendCircuitBreaker(Clock clock) {
        return new CircuitBreaker("analysis-backend",
                properties.getCircuitBreaker().getFailureThreshold(),
                properties.getCircuitBreaker().getOpenDuration(),
                clock);
    }

    @Bean
    public ConcurrencyGate backendConcurrencyGate() {
        return new ConcurrencyGate(properties.getBackend().getMaxConcurrentRequests());
    }

    @Bean
    public BackendClient backendClient(WebClient webClient) {
        return new NimBackendClient(webClient, properties.getBackend());
    }

    @Bean
    public PromptBuilder promptBuilder() {
        return new PromptBuilder(properties.getBackend());
    }

    @Bean
    public CredentialProvider credentialProvider(Environment environment) {
        return new EnvironmentCredentialProvider(environment);
    }

    @Bean
    public AnalysisEventSink analysisEventSink(ApplicationEventPublisher publisher) {
        return new SpringAnalysisEventSink(publisher);
    }

    @Bean
    public OfflineResponseGenerator offlineResponseGenerator(Clock clock) {
        OfflineResponseGenerator generator = new OfflineResponseGenerator(properties.getOffline(), clock, new Random());
        generator.preloadSamples();
        return generator;
    }

    @Bean
    public BatchDispatcher batchDispatcher(BackendClient backendClient,
                                           PromptBuilder promptBuilder,
                                           ObjectMapper objectMapper,
                                           CircuitBreaker backendCircuitBreaker,
                                           ConcurrencyGate backendConcurrencyGate,
                                           CredentialProvider credentialProvider,
                                           Clock clock) {
        return new BatchDispatcher(backendClient,
                promptBuilder,
                new BackendResponseParser(objectMapper),
                backendCircuitBreaker,
                backendConcurrencyGate,
                credentialProvider,
                properties.getBackend().getApiKeyName(),
                new ServiceStatusTracker(clock));
    }

    /**
     * One thread per concurrency-gate permit; further clusters wait in the queue.
     * A full queue makes the gateway run a cluster inline.
     */
    @Bean
    public ThreadPoolTaskExecutor dispatchExecutor() {
        int slots = properties.getBackend().getMaxConcurrentRequests();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(slots);
        executor.setMaxPoolSize(slots);
        executor.setQueueCapacity(DISPATCH_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("civica-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean(destroyMethod = "stop")
    public SimulationAiGateway simulationAiGateway(RequestKeyGenerator keyGenerator,
                                                   ResponseCacheService responseCacheService,
                                                   ClusteringBatcher clusteringBatcher,
                                                   BatchDispatcher batchDispatcher,
                                                   OfflineResponseGenerator offlineResponseGenerator,
                                                   PromptBuilder promptBuilder,
                                                   AnalysisEventSink analysisEventSink,
                                                   ThreadPoolTaskExecutor dispatchExecutor,
                                                   Clock clock) {
        return new SimulationAiGateway(keyGenerator,
                responseCacheService,
                clusteringBatcher,
                batchDispatcher,
                new OfflineAnalysisService(offlineResponseGenerator),
                new ResponseCustomizer(new Random()),
                promptBuilder,
                analysisEventSink,
                dispatchExecutor,
                properties.getBatching(),
                clock);
    }

    @Bean
    public ApplicationRunner gatewayStarter(SimulationAiGateway gateway) {
        return args -> {
            if (properties.getGateway().isAutoStart()) {
                gateway.start();
            } else {
                log.info("Gateway auto-start disabled; call start() or drive tick() from the host");
            }
        };
    }
}
