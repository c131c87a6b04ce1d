package com.insights.precompute.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

public record FeatureFlagState(
        boolean enabled,
        Instant lastUpdated,
        Source source
) {
    public enum Source {
        DEFAULT, ENV, RUNTIME;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }
}
