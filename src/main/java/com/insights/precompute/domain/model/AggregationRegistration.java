package com.insights.precompute.domain.model;

import java.util.Objects;

/**
 * Binds an aggregation type to its compute function and optional validator.
 *
 * @param type       aggregation type name, e.g. {@code "kpi"}
 * @param resultType payload class, used to decode values read back from the durable tier
 * @param compute    pure function of filters and records
 * @param validator  optional post-compute check; may be null
 */
public record AggregationRegistration<T>(
        String type,
        Class<T> resultType,
        AggregationFunction<T> compute,
        AggregationValidator<T> validator
) {
    public AggregationRegistration {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(resultType, "resultType");
        Objects.requireNonNull(compute, "compute");
    }

    public static <T> AggregationRegistration<T> of(String type, Class<T> resultType, AggregationFunction<T> compute) {
        return new AggregationRegistration<>(type, resultType, compute, null);
    }

    public AggregationRegistration<T> withValidator(AggregationValidator<T> newValidator) {
        return new AggregationRegistration<>(type, resultType, compute, newValidator);
    }

    @FunctionalInterface
    public interface AggregationFunction<T> {
        T compute(AggregationComputeContext context);
    }

    /**
     * Throws to reject a computed result.
     */
    @FunctionalInterface
    public interface AggregationValidator<T> {
        void validate(T result, AggregationComputeContext context);
    }
}
