package com.sportsdata.application.cache;

/**
 * Point-in-time counters of a {@link DataCache}.
 *
 * @param size      live entries (expired entries not yet read are included)
 * @param hits      lookups that returned a value
 * @param misses    lookups that found nothing or an expired entry
 * @param evictions entries removed to make room for new ones
 * @param hitRate   hits / (hits + misses), 0 before the first lookup
 */
public record CacheStats(int size, long hits, long misses, long evictions, double hitRate) {}
