package com.insights.precompute.application;

import com.insights.precompute.domain.model.FilterOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FilterDefaultsPreprocessorTest {

    private final FilterDefaultsPreprocessor preprocessor = new FilterDefaultsPreprocessor();

    @Test
    void shouldFillMissingScalarsWithAll() {
        // When
        FilterOptions result = preprocessor.process(new FilterOptions(null, "  ", null, null));

        // Then
        assertThat(result.timeframe()).isEqualTo("All");
        assertThat(result.product()).isEqualTo("All");
        assertThat(result.topics()).isNull();
        assertThat(result.channels()).isNull();
    }

    @Test
    void shouldDropBlankEntriesAndTrimTheRest() {
        // When
        FilterOptions result = preprocessor.process(new FilterOptions(
                "YTD", " YouTube ", List.of(" Tech", "", "Music"), List.of("  ")));

        // Then
        assertThat(result.timeframe()).isEqualTo("YTD");
        assertThat(result.product()).isEqualTo("YouTube");
        assertThat(result.topics()).containsExactly("Tech", "Music");
        assertThat(result.channels()).isEmpty();
    }
}
