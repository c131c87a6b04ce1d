package com.insights.precompute.domain.exception;

/**
 * Programmer error: the requested aggregation type was never registered.
 */
public class AggregationNotRegisteredException extends AggregationException {

    private final String aggregationType;

    public AggregationNotRegisteredException(String aggregationType) {
        super("No aggregation registered for type \"" + aggregationType + "\"");
        this.aggregationType = aggregationType;
    }

    public String getAggregationType() {
        return aggregationType;
    }
}
