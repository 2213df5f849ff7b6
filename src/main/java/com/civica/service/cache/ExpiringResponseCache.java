package com.civica.service.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, TTL-bound in-memory cache with deterministic eviction.
 *
 * <ul>
 *   <li>An entry is valid only while {@code now - createdAt < ttl}; an expired entry
 *       found by {@link #get} is removed and reported as a miss.</li>
 *   <li>The size never exceeds {@code maxSize}; storing into a full cache evicts exactly
 *       one entry first (oldest created, or least recently used).</li>
 *   <li>Re-storing an existing key replaces the entry and resets its creation time.</li>
 * </ul>
 *
 * All mutations go through one lock; hit/miss counters are atomics readable without it.
 *
 * @param <V> cached value type
 */
@Slf4j
public class ExpiringResponseCache<V> {

    private final String name;
    private final int maxSize;
    private final Duration ttl;
    private final EvictionPolicy evictionPolicy;
    private final Clock clock;

    // Iteration order = eviction order (insertion order, or access order for LRU)
    private final LinkedHashMap<String, CacheEntry<V>> entries;
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public ExpiringResponseCache(String name, int maxSize, Duration ttl, EvictionPolicy evictionPolicy, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache '" + name + "' max size must be positive: " + maxSize);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache '" + name + "' TTL must be positive: " + ttl);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.evictionPolicy = evictionPolicy;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, evictionPolicy == EvictionPolicy.LEAST_RECENTLY_USED);
    }

    /**
     * Look up a live entry.
     *
     * @param key cache key
     * @return the value, or empty when absent or expired
     */
    public Optional<V> get(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            if (entry.isExpired(now, ttl)) {
                entries.remove(key);
                expirations.incrementAndGet();
                misses.incrementAndGet();
                log.debug("Cache '{}' entry expired on lookup: {}", name, key);
                return Optional.empty();
            }
            entry.recordAccess(now);
            hits.incrementAndGet();
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a value, evicting one entry first when the cache is full.
     *
     * @param key   cache key
     * @param value value to cache
     */
    public void put(String key, V value) {
        Instant now = clock.instant();
        lock.lock();
        try {
            // Remove first so a refreshed key moves to the young end
            boolean replaced = entries.remove(key) != null;
            if (!replaced && entries.size() >= maxSize) {
                evictOne();
            }
            entries.put(key, new CacheEntry<>(value, now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every expired entry.
     *
     * @return number of entries removed
     */
    public int removeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now, ttl)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            expirations.addAndGet(removed);
            log.debug("Cache '{}' swept {} expired entries", name, removed);
        }
        return removed;
    }

    /**
     * Entry with its metadata, without touching counters or access order.
     */
    CacheEntry<V> peek(String key) {
        lock.lock();
        try {
            // get() would reorder an access-ordered map
            for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
                if (e.getKey().equals(key)) {
                    return e.getValue();
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(String key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cache '{}' cleared", name);
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getExpirations() {
        return expirations.get();
    }

    /**
     * Hits / lookups, 0.0 before the first lookup.
     */
    public double hitRatio() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    public String getName() {
        return name;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    /**
     * Caller holds the lock. The head of the linked map is the eviction victim:
     * oldest insertion for OLDEST, least recent access for LRU.
     */
    private void evictOne() {
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            Map.Entry<String, CacheEntry<V>> victim = it.next();
            it.remove();
            evictions.incrementAndGet();
            log.debug("Cache '{}' full ({}), evicted {} ({})", name, maxSize, victim.getKey(), evictionPolicy);
        }
    }

    /**
     * Cached value with creation and access metadata.
     */
    static final class CacheEntry<V> {
        private final V value;
        private final Instant createdAt;
        private Instant lastAccessedAt;
        private long accessCount;

        CacheEntry(V value, Instant createdAt) {
            this.value = value;
            this.createdAt = createdAt;
            this.lastAccessedAt = createdAt;
        }

        boolean isExpired(Instant now, Duration ttl) {
            return Duration.between(createdAt, now).compareTo(ttl) >= 0;
        }

        void recordAccess(Instant now) {
            lastAccessedAt = now;
            accessCount++;
        }

        V getValue() {
            return value;
        }

        Instant getCreatedAt() {
            return createdAt;
        }

        Instant getLastAccessedAt() {
            return lastAccessedAt;
        }

        long getAccessCount() {
            return accessCount;
        }
    }
}
