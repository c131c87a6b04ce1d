package com.insights.precompute.domain.exception;

/**
 * No viable path to data: the cache path is disabled and no fallback was supplied.
 */
public class AggregationUnavailableException extends AggregationException {

    public AggregationUnavailableException(String message) {
        super(message);
    }
}
