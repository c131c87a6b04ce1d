package com.insights.precompute.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cached unit: the aggregation payload plus timestamps, schema version and provenance.
 */
public record AggregationEnvelope<T>(
        T data,
        Instant computedAt,
        Instant expiresAt,
        int version,
        Map<String, Object> metadata,
        AggregationSource source
) {
    public AggregationEnvelope {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public boolean isExpiredAt(Instant instant) {
        return !expiresAt.isAfter(instant);
    }

    public AggregationEnvelope<T> withSource(AggregationSource newSource) {
        return new AggregationEnvelope<>(data, computedAt, expiresAt, version, metadata, newSource);
    }

    /**
     * Same envelope with its payload checked against the given type.
     */
    public <R> AggregationEnvelope<R> as(Class<R> type) {
        return new AggregationEnvelope<>(type.cast(data), computedAt, expiresAt, version, metadata, source);
    }

    public AggregationEnvelope<T> withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new AggregationEnvelope<>(data, computedAt, expiresAt, version, merged, source);
    }
}
