package com.insights.precompute.domain.model;

import java.util.Map;

/**
 * Durable-tier wire shape of an envelope.
 * Timestamps are ISO-8601 strings; there is no source field, reads always come back as durable.
 */
public record StoredAggregationRecord<T>(
        String id,
        String userId,
        String aggregationType,
        String filterHash,
        T data,
        String computedAt,
        String expiresAt,
        int version,
        Map<String, Object> metadata
) {
    public AggregationKey key() {
        return new AggregationKey(userId, aggregationType, filterHash);
    }

    public StoredAggregationRecord<T> withId(String newId) {
        return new StoredAggregationRecord<>(newId, userId, aggregationType, filterHash,
                data, computedAt, expiresAt, version, metadata);
    }
}
