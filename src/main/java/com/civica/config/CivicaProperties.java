package com.civica.config;

import com.civica.service.cache.EvictionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for Civica.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "civica")
public class CivicaProperties {

    @Valid
    private BatchingConfig batching = new BatchingConfig();
    @Valid
    private SimilarityConfig similarity = new SimilarityConfig();
    @Valid
    private CacheConfig cache = new CacheConfig();
    @Valid
    private BackendConfig backend = new BackendConfig();
    @Valid
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    @Valid
    private OfflineConfig offline = new OfflineConfig();
    private GatewayConfig gateway = new GatewayConfig();

    @Data
    public static class BatchingConfig {
        @Min(1)
        private int maxBatchSize = 50;
        @Min(1)
        private int minBatchSize = 5;
        @Min(1)
        private int maxClusterSize = 20;
        @NotNull
        private Duration batchTimeout = Duration.ofSeconds(2);
        @NotNull
        private Duration tickInterval = Duration.ofMillis(250);
        private boolean backgroundFlush = true;
    }

    @Data
    public static class SimilarityConfig {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double opinionThreshold = 0.15;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double behaviorThreshold = 0.20;
        @Min(0)
        private int maxAgeDifference = 15;
    }

    @Data
    public static class CacheConfig {
        @Valid
        private TierConfig exact = new TierConfig(1000, Duration.ofHours(1), EvictionPolicy.OLDEST);
        @Valid
        private TierConfig bucket = new TierConfig(500, Duration.ofHours(24), EvictionPolicy.OLDEST);
    }

    @Data
    public static class TierConfig {
        @Min(1)
        private int maxSize;
        @NotNull
        private Duration ttl;
        @NotNull
        private EvictionPolicy eviction;

        public TierConfig() {
            this(1000, Duration.ofHours(1), EvictionPolicy.OLDEST);
        }

        public TierConfig(int maxSize, Duration ttl, EvictionPolicy eviction) {
            this.maxSize = maxSize;
            this.ttl = ttl;
            this.eviction = eviction;
        }
    }

    @Data
    public static class BackendConfig {
        private String baseUrl = "https://integrate.api.nvidia.com/v1";
        private String model = "nvidia/llama-3.1-nemotron-70b-instruct";
        private String apiKeyName = "nvidia_nim_api_key";
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
        @Min(1)
        private int maxConcurrentRequests = 3;
        private int analysisMaxTokens = 500;
        private double analysisTemperature = 0.3;
        private int generationMaxTokens = 1000;
        private double generationTemperature = 0.7;
    }

    @Data
    public static class CircuitBreakerConfig {
        @Min(1)
        private int failureThreshold = 5;
        @NotNull
        private Duration openDuration = Duration.ofSeconds(30);
    }

    @Data
    public static class OfflineConfig {
        @Min(1)
        private int maxCachedResponses = 1000;
        @NotNull
        private Duration cacheTtl = Duration.ofDays(7);
        private boolean templateSystem = true;
        private boolean ruleBasedGeneration = true;
    }

    @Data
    public static class GatewayConfig {
        private boolean autoStart = true;
    }
}
