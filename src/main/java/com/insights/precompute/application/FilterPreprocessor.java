package com.insights.precompute.application;

import com.insights.precompute.domain.model.FilterOptions;

/**
 * Resolves derived or implicit filter values before records are loaded.
 * Preprocessors run in {@link org.springframework.core.annotation.Order} order, each one
 * receiving the output of the previous.
 */
@FunctionalInterface
public interface FilterPreprocessor {

    FilterOptions process(FilterOptions filters);
}
