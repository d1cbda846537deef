package com.document.resource.cache;

/**
 * Cache metrics.
 *
 * @param hitCount      number of reads served from the cache
 * @param missCount     number of reads that found no live entry
 * @param evictionCount number of entries evicted by the size bound
 * @param expiredCount  number of entries removed because their TTL elapsed
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long expiredCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}
