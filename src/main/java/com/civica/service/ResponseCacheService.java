package com.civica.service;

import com.civica.config.CivicaProperties;
import com.civica.model.AnalysisResult;
import com.civica.service.cache.ExpiringResponseCache;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

/**
 * Two-tier response cache: exact content (full-precision key) and similarity
 * bucket (quantized key).
 *
 * Flow:
 * 1. Check the exact tier
 * 2. If miss, check the bucket tier
 * 3. Miss falls through to clustering
 *
 * The tiers have independent TTLs and capacities and are not kept consistent
 * with each other: one may hold a fresher result than the other.
 */
@Slf4j
public class ResponseCacheService {

    private final ExpiringResponseCache<AnalysisResult> exactCache;
    private final ExpiringResponseCache<AnalysisResult> bucketCache;

    public ResponseCacheService(CivicaProperties.CacheConfig config, Clock clock) {
        this(new ExpiringResponseCache<>("exact",
                        config.getExact().getMaxSize(),
                        config.getExact().getTtl(),
                        config.getExact().getEviction(),
                        clock),
                new ExpiringResponseCache<>("bucket",
                        config.getBucket().getMaxSize(),
                        config.getBucket().getTtl(),
                        config.getBucket().getEviction(),
                        clock));
    }

    ResponseCacheService(ExpiringResponseCache<AnalysisResult> exactCache,
                         ExpiringResponseCache<AnalysisResult> bucketCache) {
        this.exactCache = exactCache;
        this.bucketCache = bucketCache;
    }

    /**
     * Get cached result (exact, then bucket).
     *
     * @param exactKey  exact-content key
     * @param bucketKey similarity-bucket key
     * @return cached result if found in either tier
     */
    public Optional<CacheResult> get(String exactKey, String bucketKey) {
        Optional<AnalysisResult> exact = exactCache.get(exactKey);
        if (exact.isPresent()) {
            log.debug("Cache HIT (exact): {}", exactKey);
            return Optional.of(new CacheResult(exact.get(), MatchType.EXACT));
        }

        Optional<AnalysisResult> bucket = bucketCache.get(bucketKey);
        if (bucket.isPresent()) {
            log.debug("Cache HIT (bucket): {}", bucketKey);
            return Optional.of(new CacheResult(bucket.get(), MatchType.BUCKET));
        }

        log.debug("Cache MISS: bucket={}", bucketKey);
        return Optional.empty();
    }

    /**
     * Store a result in both tiers.
     */
    public void put(String exactKey, String bucketKey, AnalysisResult result) {
        exactCache.put(exactKey, result);
        bucketCache.put(bucketKey, result);
    }

    /**
     * Remove expired entries from both tiers.
     *
     * @return number of entries removed
     */
    public int removeExpired() {
        return exactCache.removeExpired() + bucketCache.removeExpired();
    }

    public void clear() {
        exactCache.clear();
        bucketCache.clear();
        log.info("Cleared response cache (exact + bucket)");
    }

    /**
     * Entries held by both tiers together.
     */
    public int size() {
        return exactCache.size() + bucketCache.size();
    }

    public ExpiringResponseCache<AnalysisResult> getExactCache() {
        return exactCache;
    }

    public ExpiringResponseCache<AnalysisResult> getBucketCache() {
        return bucketCache;
    }

    /**
     * Cache lookup result.
     */
    @Value
    public static class CacheResult {
        AnalysisResult result;
        MatchType matchType;
    }

    /**
     * Match type enum.
     */
    public enum MatchType {
        EXACT,      // Full-precision content match
        BUCKET      // Quantized similarity signature match
    }
}
