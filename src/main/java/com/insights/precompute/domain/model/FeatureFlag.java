package com.insights.precompute.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum FeatureFlag {
    PRECOMPUTATION_SERVICE("precomputationService", false),
    PRECOMPUTATION_BACKFILL("precomputationBackfill", false),
    PRECOMPUTATION_FALLBACKS("precomputationFallbacks", true);

    private final String key;
    private final boolean defaultValue;

    FeatureFlag(String key, boolean defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String key() {
        return key;
    }

    public boolean defaultValue() {
        return defaultValue;
    }

    /**
     * Accepts either the camelCase key or the enum constant name
     */
    public static Optional<FeatureFlag> fromKey(String name) {
        return Arrays.stream(values())
                .filter(flag -> flag.key.equals(name) || flag.name().equals(name))
                .findFirst();
    }
}
