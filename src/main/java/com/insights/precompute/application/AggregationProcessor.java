package com.insights.precompute.application;

import com.insights.precompute.domain.exception.AggregationNotRegisteredException;
import com.insights.precompute.domain.exception.AggregationValidationException;
import com.insights.precompute.domain.model.AggregationComputeContext;
import com.insights.precompute.domain.model.AggregationRegistration;
import com.insights.precompute.domain.model.FilterOptions;
import com.insights.precompute.domain.model.WatchRecord;
import com.insights.precompute.domain.port.out.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregation registry and compute pipeline:
 * preprocess filters, load records, compute, validate.
 */
@Service
public class AggregationProcessor {

    private static final Logger logger = LoggerFactory.getLogger(AggregationProcessor.class);

    private final RecordSource recordSource;
    private final List<FilterPreprocessor> preprocessors;
    private final Map<String, AggregationRegistration<?>> registry = new ConcurrentHashMap<>();

    public AggregationProcessor(RecordSource recordSource,
                                List<FilterPreprocessor> preprocessors,
                                List<AggregationRegistration<?>> registrations) {
        this.recordSource = recordSource;
        this.preprocessors = List.copyOf(preprocessors);
        registerAll(registrations);
    }

    public void register(AggregationRegistration<?> registration) {
        AggregationRegistration<?> existing = registry.putIfAbsent(registration.type(), registration);
        if (existing != null) {
            throw new IllegalStateException("Aggregation \"" + registration.type() + "\" is already registered");
        }
        logger.info("Registered aggregation {} -> {}", registration.type(), registration.resultType().getSimpleName());
    }

    public void registerAll(Collection<? extends AggregationRegistration<?>> registrations) {
        registrations.forEach(this::register);
    }

    public boolean has(String type) {
        return registry.containsKey(type);
    }

    public List<String> list() {
        return new ArrayList<>(registry.keySet());
    }

    public Class<?> resultType(String type) {
        return lookup(type).resultType();
    }

    public Object compute(String type, String userId, FilterOptions filters) {
        AggregationRegistration<?> registration = lookup(type);

        FilterOptions prepared = prepareFilters(filters);
        List<WatchRecord> records = recordSource.loadRecords(userId, prepared);
        AggregationComputeContext context = new AggregationComputeContext(userId, prepared, records);

        logger.debug("Computing {} for user {} over {} records", type, userId, records.size());
        return computeAndValidate(registration, context);
    }

    public <T> T compute(String type, String userId, FilterOptions filters, Class<T> resultType) {
        return resultType.cast(compute(type, userId, filters));
    }

    /**
     * Runs the preprocessors over a copy of the filters. Cache keys are built from this form.
     */
    public FilterOptions prepareFilters(FilterOptions filters) {
        FilterOptions current = filters.copy();
        for (FilterPreprocessor preprocessor : preprocessors) {
            current = preprocessor.process(current);
        }
        return current;
    }

    private AggregationRegistration<?> lookup(String type) {
        AggregationRegistration<?> registration = registry.get(type);
        if (registration == null) {
            throw new AggregationNotRegisteredException(type);
        }
        return registration;
    }

    private static <R> R computeAndValidate(AggregationRegistration<R> registration,
                                            AggregationComputeContext context) {
        R result = registration.compute().compute(context);

        if (registration.validator() != null) {
            try {
                registration.validator().validate(result, context);
            } catch (RuntimeException e) {
                logger.error("Aggregation {} for user {} failed validation: {}",
                        registration.type(), context.userId(), e.getMessage());
                throw new AggregationValidationException(registration.type(), e);
            }
        }

        return result;
    }
}
