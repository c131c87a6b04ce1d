package com.insights.precompute.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.FilterOptions;
import com.insights.precompute.domain.model.NormalizedFilterSet;

import java.util.List;
import java.util.Objects;

/**
 * Canonicalizes filter sets and derives cache keys from them.
 * Two filters with the same scalars and the same topic/channel sets always hash identically.
 */
public final class FilterNormalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FilterNormalizer() {
    }

    public static NormalizedFilterSet normalize(FilterOptions filters) {
        return new NormalizedFilterSet(
                filters.timeframe(),
                filters.product(),
                sortedDistinct(filters.topics()),
                sortedDistinct(filters.channels())
        );
    }

    public static String hash(NormalizedFilterSet normalized) {
        try {
            return MAPPER.writeValueAsString(normalized);
        } catch (JsonProcessingException e) {
            // strings and lists only, cannot happen
            throw new IllegalStateException("Failed to serialize normalized filters", e);
        }
    }

    public static String hash(FilterOptions filters) {
        return hash(normalize(filters));
    }

    public static AggregationKey buildKey(String userId, String aggregationType, FilterOptions filters) {
        return new AggregationKey(userId, aggregationType, hash(filters));
    }

    private static List<String> sortedDistinct(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }
}
