package com.insights.precompute.application;

import com.insights.precompute.domain.FilterNormalizer;
import com.insights.precompute.domain.exception.AggregationNotRegisteredException;
import com.insights.precompute.domain.exception.AggregationUnavailableException;
import com.insights.precompute.domain.exception.AggregationValidationException;
import com.insights.precompute.domain.model.AggregationEnvelope;
import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.AggregationSource;
import com.insights.precompute.domain.model.FeatureFlag;
import com.insights.precompute.infrastructure.cache.AggregationCacheConfig;
import com.insights.precompute.infrastructure.cache.AggregationCacheStrategy;
import com.insights.precompute.infrastructure.cache.CacheRetrievalResult;
import com.insights.precompute.infrastructure.flags.FeatureFlagRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Public entry point for precomputed aggregations.
 * Ties together feature flags, the cache tiers, the compute pipeline and caller fallbacks.
 * Holds no mutable state of its own, so one instance serves all callers.
 */
@Service
public class AggregationService {

    private static final Logger logger = LoggerFactory.getLogger(AggregationService.class);

    private final AggregationCacheStrategy cache;
    private final AggregationProcessor processor;
    private final FeatureFlagRegistry flags;
    private final InFlightComputations inFlight;
    private final AggregationCacheConfig config;
    private final AggregationMetadataFactory metadataFactory;
    private final Clock clock;

    public AggregationService(AggregationCacheStrategy cache,
                              AggregationProcessor processor,
                              FeatureFlagRegistry flags,
                              InFlightComputations inFlight,
                              AggregationCacheConfig config,
                              AggregationMetadataFactory metadataFactory,
                              Clock clock) {
        this.cache = cache;
        this.processor = processor;
        this.flags = flags;
        this.inFlight = inFlight;
        this.config = config;
        this.metadataFactory = metadataFactory;
        this.clock = clock;
    }

    public <T> AggregationEnvelope<T> getAggregation(AggregationRequest<T> request) {
        if (!flags.isEnabled(FeatureFlag.PRECOMPUTATION_SERVICE)) {
            logger.debug("Precomputation disabled, serving {} for {} via fallback", request.type(), request.userId());
            return computeViaFallback(request, null);
        }

        AggregationKey key = toKey(request);
        Class<T> resultType = resultTypeOf(request.type());

        if (!request.forceRefresh()) {
            Optional<CacheRetrievalResult<T>> cached = cache.get(key, resultType);
            if (cached.isPresent()) {
                AggregationEnvelope<T> entry = cached.get().entry();
                if (entry.version() == config.getSchemaVersion()) {
                    logger.debug("Serving {} from {} layer", key.toCacheKey(), cached.get().hitLayer().value());
                    return entry;
                }
                // recompute overwrites both layers
                logger.info("Discarding {} cached under schema version {}, current is {}",
                        key.toCacheKey(), entry.version(), config.getSchemaVersion());
            }
        }

        return computeAndPersist(request, key, resultType);
    }

    /**
     * Always recomputes and persists, whatever the master flag says
     */
    public <T> AggregationEnvelope<T> refreshAggregation(AggregationRequest<T> request) {
        AggregationKey key = toKey(request);
        logger.info("Refreshing aggregation {}", key.toCacheKey());
        return computeAndPersist(request, key, resultTypeOf(request.type()));
    }

    public void clearAggregation(AggregationRequest<?> request) {
        AggregationKey key = toKey(request);
        cache.delete(key);
        logger.info("Cleared aggregation {}", key.toCacheKey());
    }

    private <T> AggregationEnvelope<T> computeAndPersist(AggregationRequest<T> request,
                                                         AggregationKey key,
                                                         Class<T> resultType) {
        try {
            AggregationEnvelope<?> shared = inFlight.execute(key.toCacheKey(), AggregationEnvelope.class, () -> {
                T data = processor.compute(request.type(), request.userId(), request.filters(), resultType);
                AggregationEnvelope<T> envelope = buildEnvelope(data, request);
                cache.set(key, envelope);
                return envelope;
            });
            return shared.as(resultType);
        } catch (AggregationNotRegisteredException | AggregationValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (request.fallbackCompute() != null && flags.isEnabled(FeatureFlag.PRECOMPUTATION_FALLBACKS)) {
                logger.warn("Compute failed for {}, serving fallback: {}", key.toCacheKey(), e.getMessage());
                return computeViaFallback(request, e);
            }

            logger.error("Compute failed for {} with no fallback available", key.toCacheKey(), e);
            throw e;
        }
    }

    private <T> AggregationEnvelope<T> computeViaFallback(AggregationRequest<T> request, Throwable reason) {
        if (request.fallbackCompute() == null) {
            throw new AggregationUnavailableException(
                    "Pre-computation fallback unavailable for aggregation \"" + request.type() + "\"");
        }

        T result = request.fallbackCompute().get();

        Map<String, Object> degraded = new LinkedHashMap<>();
        degraded.put("fallback", true);
        if (reason != null && reason.getMessage() != null) {
            degraded.put("reason", reason.getMessage());
        }

        // degraded results are never written to the cache
        return buildEnvelope(result, request).withMetadata(degraded);
    }

    private <T> AggregationEnvelope<T> buildEnvelope(T data, AggregationRequest<T> request) {
        Instant computedAt = clock.instant();
        Instant expiresAt = computedAt.plus(config.resolveTtl(request.type()));

        return new AggregationEnvelope<>(
                data,
                computedAt,
                expiresAt,
                config.getSchemaVersion(),
                metadataFactory.create(data, request),
                AggregationSource.COMPUTED
        );
    }

    /**
     * The only unchecked cast: a request's declared type is trusted to match its registration.
     * Payloads are still checked with {@link Class#cast} wherever they cross a layer.
     */
    @SuppressWarnings("unchecked")
    private <T> Class<T> resultTypeOf(String type) {
        return (Class<T>) processor.resultType(type);
    }

    private AggregationKey toKey(AggregationRequest<?> request) {
        return FilterNormalizer.buildKey(request.userId(), request.type(), processor.prepareFilters(request.filters()));
    }
}
