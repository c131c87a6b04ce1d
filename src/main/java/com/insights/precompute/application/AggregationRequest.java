package com.insights.precompute.application;

import com.insights.precompute.domain.model.FilterOptions;

import java.util.function.Supplier;

/**
 * One call to the aggregation service.
 *
 * @param fallbackCompute optional direct computation used when the cache path is off or compute fails
 */
public record AggregationRequest<T>(
        String userId,
        String type,
        FilterOptions filters,
        boolean forceRefresh,
        Supplier<T> fallbackCompute
) {
    public static <T> AggregationRequest<T> of(String userId, String type, FilterOptions filters) {
        return new AggregationRequest<>(userId, type, filters, false, null);
    }

    public AggregationRequest<T> withForceRefresh(boolean refresh) {
        return new AggregationRequest<>(userId, type, filters, refresh, fallbackCompute);
    }

    public AggregationRequest<T> withFallback(Supplier<T> fallback) {
        return new AggregationRequest<>(userId, type, filters, forceRefresh, fallback);
    }
}
