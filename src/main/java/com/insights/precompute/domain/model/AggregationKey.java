package com.insights.precompute.domain.model;

/**
 * Identifies one cached aggregation value.
 * The filter hash is always derived from a filter set, never built by hand.
 */
public record AggregationKey(
        String userId,
        String aggregationType,
        String filterHash
) {
    /**
     * Flat form used by the memory map, the durable tier and the single-flight guard.
     * Separators inside the user id or type are escaped, so distinct keys never flatten alike.
     */
    public String toCacheKey() {
        return escape(userId) + ":" + escape(aggregationType) + ":" + filterHash;
    }

    private static String escape(String part) {
        return part.replace("\\", "\\\\").replace(":", "\\:");
    }
}
