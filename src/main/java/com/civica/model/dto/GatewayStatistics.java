package com.civica.model.dto;

import com.civica.service.resilience.CircuitBreakerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only snapshot of the gateway's batching and caching behavior.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayStatistics {

    /**
     * Requests answered by either cache tier / all requests (0.0-1.0).
     */
    private double cacheHitRatio;

    /**
     * Requests satisfied through a shared cluster dispatch / all requests (0.0-1.0).
     */
    private double batchingEfficiency;

    /**
     * Entries currently held by both tiers.
     */
    private int activeCacheEntries;

    /**
     * Clusters dispatched and not yet completed.
     */
    private int activeBatches;

    /**
     * Mean member count over every cluster dispatched so far.
     */
    private double averageBatchSize;

    private long totalRequests;
    private long exactCacheHits;
    private long bucketCacheHits;
    private long batchedRequests;
    private long clustersDispatched;
    private long fallbackResults;
    private int pendingRequests;
    private CircuitBreakerState circuitState;

    /**
     * Offline generator cache hits / offline lookups (0.0-1.0).
     */
    private double offlineCacheHitRate;
    private int offlineCachedResponses;
    private long offlineGeneratedResponses;
}
