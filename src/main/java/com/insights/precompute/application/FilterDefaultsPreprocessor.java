package com.insights.precompute.application;

import com.insights.precompute.domain.model.FilterOptions;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fills a missing timeframe or product with "All" and drops blank topics and channels
 */
@Component
@Order(0)
public class FilterDefaultsPreprocessor implements FilterPreprocessor {

    @Override
    public FilterOptions process(FilterOptions filters) {
        return new FilterOptions(
                orAll(filters.timeframe()),
                orAll(filters.product()),
                withoutBlanks(filters.topics()),
                withoutBlanks(filters.channels())
        );
    }

    private static String orAll(String value) {
        return value == null || value.isBlank() ? FilterOptions.ALL : value.trim();
    }

    private static List<String> withoutBlanks(List<String> values) {
        if (values == null) {
            return null;
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .toList();
    }
}
