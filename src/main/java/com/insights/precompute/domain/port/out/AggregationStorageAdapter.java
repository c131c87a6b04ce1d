package com.insights.precompute.domain.port.out;

import com.fasterxml.jackson.databind.JsonNode;
import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.StoredAggregationRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable persistence contract for aggregation records.
 * Any key-value or document store can back it; payloads are kept as JSON trees.
 */
public interface AggregationStorageAdapter {

    void store(StoredAggregationRecord<JsonNode> record);

    Optional<StoredAggregationRecord<JsonNode>> fetch(AggregationKey key);

    /**
     * Missing entries are a no-op
     */
    default void remove(AggregationKey key) {
    }

    /**
     * Records whose expiry is at or before the given instant, matching {@code AggregationEnvelope#isExpiredAt}.
     * Only used by maintenance sweeps.
     */
    default List<StoredAggregationRecord<JsonNode>> fetchExpired(Instant reference) {
        return List.of();
    }
}
