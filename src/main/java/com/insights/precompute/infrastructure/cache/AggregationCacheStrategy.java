package com.insights.precompute.infrastructure.cache;

import com.insights.precompute.domain.model.AggregationEnvelope;
import com.insights.precompute.domain.model.AggregationKey;

import java.util.Optional;

/**
 * Cache strategy abstraction
 * Allows different caching implementations without changing the orchestration logic
 */
public interface AggregationCacheStrategy {

    /**
     * Try to get a fresh envelope for the key
     * @return Optional.empty() on a miss or when only expired entries exist
     */
    <T> Optional<CacheRetrievalResult<T>> get(AggregationKey key, Class<T> resultType);

    /**
     * Store an envelope in every layer; durable failures never surface
     */
    void set(AggregationKey key, AggregationEnvelope<?> envelope);

    /**
     * Remove the key from every layer; a missing entry is not an error
     */
    void delete(AggregationKey key);

    /**
     * Drop expired entries
     * @return number of entries removed across layers
     */
    int sweepExpired();

    CacheStats getStats();
}
