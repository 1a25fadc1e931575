package com.sportsdata.application.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache slot. Replacing a value means inserting a new entry under the same key.
 *
 * @param key       cache key
 * @param payload   cached value
 * @param createdAt insertion time, also the eviction order
 * @param ttl       time to live measured from {@code createdAt}
 */
public record CacheEntry<K, V>(K key, V payload, Instant createdAt, Duration ttl) {

    /**
     * An entry is expired once its age is strictly greater than its TTL.
     */
    public boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
