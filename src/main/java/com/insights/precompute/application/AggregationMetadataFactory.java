package com.insights.precompute.application;

import java.util.Map;

/**
 * Supplies extra envelope metadata for a computed result
 */
@FunctionalInterface
public interface AggregationMetadataFactory {

    Map<String, Object> create(Object result, AggregationRequest<?> request);

    static AggregationMetadataFactory none() {
        return (result, request) -> Map.of();
    }
}
