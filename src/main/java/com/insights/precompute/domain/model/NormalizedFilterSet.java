package com.insights.precompute.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Canonical form of a {@link FilterOptions}: collections sorted and de-duplicated.
 */
@JsonPropertyOrder({"timeframe", "product", "topics", "channels"})
public record NormalizedFilterSet(
        String timeframe,
        String product,
        List<String> topics,
        List<String> channels
) {}
