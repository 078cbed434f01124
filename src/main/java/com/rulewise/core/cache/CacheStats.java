package com.rulewise.core.cache;

/**
 * Point-in-time counters for a {@link RulesCache}.
 *
 * @param hits    reads answered from the cache
 * @param misses  reads that found nothing usable (absent, expired or corrupt)
 * @param size    live entries
 * @param hitRate {@code hits / (hits + misses)}, or 0 before the first read
 */
public record CacheStats(long hits, long misses, int size, double hitRate) {

    static CacheStats of(long hits, long misses, int size) {
        long total = hits + misses;
        return new CacheStats(hits, misses, size, total > 0 ? (double) hits / total : 0.0);
    }
}
