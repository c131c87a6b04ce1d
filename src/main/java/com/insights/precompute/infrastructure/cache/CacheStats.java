package com.insights.precompute.infrastructure.cache;

/**
 * Cache performance metrics
 */
public record CacheStats(
        long memoryHits,
        long durableHits,
        long misses,
        long durableErrors,
        int activeEntries
) {
    public long hits() {
        return memoryHits + durableHits;
    }

    public double hitRatio() {
        long total = hits() + misses;
        return total > 0 ? (double) hits() / total : 0.0;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%% (memory %d, durable %d), Active entries: %d, Durable errors: %d",
                hitRatio() * 100, memoryHits, durableHits, activeEntries, durableErrors);
    }
}
