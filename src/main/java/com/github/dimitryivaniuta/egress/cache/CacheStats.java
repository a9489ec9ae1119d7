package com.github.dimitryivaniuta.egress.cache;

/**
 * @param hitRate     percentage of reads served by either tier
 * @param memoryUsage serialized size of local entries, in bytes
 * @param keyCount    local entries
 */
public record CacheStats(
        long hits,
        long misses,
        long sets,
        long deletes,
        double hitRate,
        long memoryUsage,
        long keyCount
) {}
