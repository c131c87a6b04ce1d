package com.insights.precompute.domain.exception;

/**
 * A computed result was rejected by its validator. Never persisted, never returned.
 */
public class AggregationValidationException extends AggregationException {

    public AggregationValidationException(String aggregationType, Throwable cause) {
        super("Validation failed for aggregation \"" + aggregationType + "\": " + cause.getMessage(), cause);
    }
}
