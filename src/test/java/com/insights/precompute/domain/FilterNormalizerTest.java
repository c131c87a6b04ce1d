package com.insights.precompute.domain;

import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.FilterOptions;
import com.insights.precompute.domain.model.NormalizedFilterSet;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FilterNormalizerTest {

    @Test
    void shouldProduceSameKeyRegardlessOfTopicAndChannelOrder() {
        // Given
        FilterOptions first = new FilterOptions("YTD", "YouTube",
                List.of("Music", "Gaming", "Tech"), List.of("Veritasium", "Kurzgesagt"));
        FilterOptions second = new FilterOptions("YTD", "YouTube",
                List.of("Tech", "Music", "Gaming", "Music"), List.of("Kurzgesagt", "Veritasium"));

        // When
        AggregationKey firstKey = FilterNormalizer.buildKey("user-1", "kpi", first);
        AggregationKey secondKey = FilterNormalizer.buildKey("user-1", "kpi", second);

        // Then
        assertThat(firstKey).isEqualTo(secondKey);
        assertThat(firstKey.toCacheKey()).isEqualTo(secondKey.toCacheKey());
    }

    @Test
    void shouldTreatMissingCollectionsAsEmpty() {
        // Given
        FilterOptions withNulls = FilterOptions.of("All", "All");
        FilterOptions withEmpty = new FilterOptions("All", "All", List.of(), List.of());

        // When & Then
        assertThat(FilterNormalizer.hash(withNulls)).isEqualTo(FilterNormalizer.hash(withEmpty));
    }

    @Test
    void shouldDropNullElementsAndSortLexicographically() {
        // Given
        FilterOptions filters = new FilterOptions("MTD", "YouTube Music",
                Arrays.asList("b", null, "a", "b"), null);

        // When
        NormalizedFilterSet normalized = FilterNormalizer.normalize(filters);

        // Then
        assertThat(normalized.timeframe()).isEqualTo("MTD");
        assertThat(normalized.product()).isEqualTo("YouTube Music");
        assertThat(normalized.topics()).containsExactly("a", "b");
        assertThat(normalized.channels()).isEmpty();
    }

    @Test
    void shouldDistinguishDifferentScalars() {
        // Given
        FilterOptions ytd = FilterOptions.of("YTD", "All");
        FilterOptions mtd = FilterOptions.of("MTD", "All");

        // When & Then
        assertThat(FilterNormalizer.hash(ytd)).isNotEqualTo(FilterNormalizer.hash(mtd));
        assertThat(FilterNormalizer.buildKey("user-1", "kpi", ytd))
                .isNotEqualTo(FilterNormalizer.buildKey("user-2", "kpi", ytd));
    }

    @Test
    void shouldSerializeFieldsInFixedOrder() {
        // When
        String hash = FilterNormalizer.hash(new FilterOptions("All", "YouTube", List.of("Tech"), null));

        // Then
        assertThat(hash).isEqualTo("{\"timeframe\":\"All\",\"product\":\"YouTube\",\"topics\":[\"Tech\"],\"channels\":[]}");
    }

    @Test
    void shouldFlattenKeyAsUserTypeAndHash() {
        // Given
        AggregationKey key = new AggregationKey("user-1", "kpi", "{}");

        // When & Then
        assertThat(key.toCacheKey()).isEqualTo("user-1:kpi:{}");
    }

    @Test
    void shouldNotCollideWhenUserOrTypeContainsSeparator() {
        // Given
        AggregationKey colonInUser = new AggregationKey("a:b", "kpi", "{}");
        AggregationKey colonInType = new AggregationKey("a", "b:kpi", "{}");

        // When & Then
        assertThat(colonInUser.toCacheKey()).isNotEqualTo(colonInType.toCacheKey());
        assertThat(colonInUser.toCacheKey()).isEqualTo("a\\:b:kpi:{}");
        assertThat(colonInType.toCacheKey()).isEqualTo("a:b\\:kpi:{}");
    }

    @Test
    void shouldEscapeBackslashesBeforeSeparators() {
        // Given
        AggregationKey trailingBackslash = new AggregationKey("a\\", "b:kpi", "{}");
        AggregationKey escapedColon = new AggregationKey("a\\:b", "kpi", "{}");

        // When & Then
        assertThat(trailingBackslash.toCacheKey()).isNotEqualTo(escapedColon.toCacheKey());
    }
}
