package com.insights.precompute.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an envelope came from on this read.
 */
public enum AggregationSource {
    MEMORY("memory"),
    DURABLE("durable"),
    COMPUTED("computed");

    private final String value;

    AggregationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
