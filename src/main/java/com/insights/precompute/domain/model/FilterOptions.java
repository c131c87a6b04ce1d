package com.insights.precompute.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Caller-supplied filter for an aggregation.
 * Topics and channels are optional; null means "no restriction".
 */
public record FilterOptions(
        String timeframe,
        String product,
        List<String> topics,
        List<String> channels
) {
    public static final String ALL = "All";

    public static FilterOptions of(String timeframe, String product) {
        return new FilterOptions(timeframe, product, null, null);
    }

    public static FilterOptions all() {
        return of(ALL, ALL);
    }

    public FilterOptions withTopics(List<String> topics) {
        return new FilterOptions(timeframe, product, topics, channels);
    }

    public FilterOptions withChannels(List<String> channels) {
        return new FilterOptions(timeframe, product, topics, channels);
    }

    /**
     * Defensive copy so preprocessors can never mutate the caller's lists
     */
    public FilterOptions copy() {
        return new FilterOptions(
                timeframe,
                product,
                topics != null ? topics.stream().filter(Objects::nonNull).toList() : null,
                channels != null ? channels.stream().filter(Objects::nonNull).toList() : null
        );
    }
}
