package com.civica.service;

import com.civica.model.AnalysisResult;
import com.civica.model.RequestType;
import com.civica.service.cache.EvictionPolicy;
import com.civica.service.cache.ExpiringResponseCache;
import com.civica.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResponseCacheService.
 */
class ResponseCacheServiceTest {

    private MutableClock clock;
    private ResponseCacheService cacheService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        cacheService = new ResponseCacheService(
                new ExpiringResponseCache<>("exact", 10, Duration.ofHours(1), EvictionPolicy.OLDEST, clock),
                new ExpiringResponseCache<>("bucket", 10, Duration.ofHours(24), EvictionPolicy.OLDEST, clock));
    }

    private static AnalysisResult result(String text) {
        return AnalysisResult.builder().requestType(RequestType.GENERAL_ANALYSIS).text(text).build();
    }

    @Test
    void testExactTierWins() {
        cacheService.put("exact-1", "bucket-1", result("first"));

        Optional<ResponseCacheService.CacheResult> hit = cacheService.get("exact-1", "bucket-1");

        assertTrue(hit.isPresent());
        assertEquals(ResponseCacheService.MatchType.EXACT, hit.get().getMatchType());
        assertEquals("first", hit.get().getResult().getText());
    }

    @Test
    void testFallsBackToBucketTier() {
        cacheService.put("exact-1", "bucket-1", result("first"));

        Optional<ResponseCacheService.CacheResult> hit = cacheService.get("exact-2", "bucket-1");

        assertTrue(hit.isPresent());
        assertEquals(ResponseCacheService.MatchType.BUCKET, hit.get().getMatchType());
    }

    @Test
    void testTiersExpireIndependently() {
        cacheService.put("exact-1", "bucket-1", result("first"));

        clock.advance(Duration.ofHours(2));

        Optional<ResponseCacheService.CacheResult> hit = cacheService.get("exact-1", "bucket-1");
        assertTrue(hit.isPresent());
        assertEquals(ResponseCacheService.MatchType.BUCKET, hit.get().getMatchType());
        assertFalse(cacheService.getExactCache().containsKey("exact-1"));
    }

    @Test
    void testMissOnBothTiers() {
        assertTrue(cacheService.get("nope", "nope").isEmpty());
    }

    @Test
    void testLastWriterWinsPerTier() {
        cacheService.put("exact-1", "shared-bucket", result("first"));
        cacheService.put("exact-2", "shared-bucket", result("second"));

        assertEquals("first", cacheService.get("exact-1", "shared-bucket").get().getResult().getText());
        assertEquals("second", cacheService.get("exact-3", "shared-bucket").get().getResult().getText());
        assertEquals(3, cacheService.size());
    }

    @Test
    void testRemoveExpiredAndClear() {
        cacheService.put("exact-1", "bucket-1", result("first"));
        clock.advance(Duration.ofHours(2));

        assertEquals(1, cacheService.removeExpired());
        assertEquals(1, cacheService.size());

        cacheService.clear();
        assertEquals(0, cacheService.size());
    }
}
