package com.sportsdata.application.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory key/value store with per-entry TTL and a hard capacity.
 *
 * <p>Expiry is lazy: an entry older than its TTL is removed when it is read. When a new key
 * is inserted at capacity, exactly one entry is evicted, the one with the oldest
 * {@code createdAt} (insertion order breaks ties).
 *
 * <p>All operations are synchronized; the cache is read by callers and written by the
 * request queue thread.
 */
public class DataCache<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(DataCache.class);

    private final Map<K, CacheEntry<K, V>> entries = new LinkedHashMap<>();
    private final int maxSize;
    private final Clock clock;

    private long hits;
    private long misses;
    private long evictions;

    public DataCache(int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached value, or empty if the key is absent or its entry has expired.
     * An expired entry is deleted on the way out.
     */
    public synchronized Optional<V> get(K key) {
        Optional<V> value = lookup(key);
        if (value.isPresent()) {
            hits++;
        } else {
            misses++;
        }
        return value;
    }

    /**
     * Stores a value. Any existing entry for the key is replaced; otherwise, when the cache is
     * full, the oldest entry is evicted first.
     */
    public synchronized void set(K key, V value, Duration ttl) {
        if (key == null || ttl == null) {
            throw new IllegalArgumentException("key and ttl are required");
        }
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }

        entries.remove(key);
        if (entries.size() >= maxSize) {
            evictOldest();
        }
        entries.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
    }

    /**
     * Same expiry semantics as {@link #get(Object)} but leaves the hit/miss counters alone.
     */
    public synchronized boolean has(K key) {
        return lookup(key).isPresent();
    }

    public synchronized boolean delete(K key) {
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        return new CacheStats(entries.size(), hits, misses, evictions, hitRate);
    }

    private Optional<V> lookup(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            logger.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.payload());
    }

    private void evictOldest() {
        CacheEntry<K, V> oldest = null;
        for (CacheEntry<K, V> candidate : entries.values()) {
            if (oldest == null || candidate.createdAt().isBefore(oldest.createdAt())) {
                oldest = candidate;
            }
        }
        if (oldest != null) {
            entries.remove(oldest.key());
            evictions++;
            logger.debug("Evicted oldest cache entry {} (capacity {})", oldest.key(), maxSize);
        }
    }
}
