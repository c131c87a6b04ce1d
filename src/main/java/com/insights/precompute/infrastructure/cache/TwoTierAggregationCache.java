package com.insights.precompute.infrastructure.cache;

import com.insights.precompute.domain.model.AggregationEnvelope;
import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.AggregationSource;
import com.insights.precompute.infrastructure.storage.AggregationStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process memory layer in front of the durable storage layer.
 * Memory is authoritative for the life of the process; the durable layer is best-effort.
 */
@Component
public class TwoTierAggregationCache implements AggregationCacheStrategy {

    private static final Logger logger = LoggerFactory.getLogger(TwoTierAggregationCache.class);

    private final Map<String, AggregationEnvelope<?>> memory = new ConcurrentHashMap<>();
    private final AggregationStorage storage;
    private final Clock clock;

    private final AtomicLong memoryHits = new AtomicLong();
    private final AtomicLong durableHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong durableErrors = new AtomicLong();

    public TwoTierAggregationCache(AggregationStorage storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
    }

    @Override
    public <T> Optional<CacheRetrievalResult<T>> get(AggregationKey key, Class<T> resultType) {
        String cacheKey = key.toCacheKey();
        Instant now = clock.instant();

        AggregationEnvelope<?> cached = memory.get(cacheKey);
        if (cached != null) {
            if (!cached.isExpiredAt(now) && isAssignable(cached, resultType)) {
                AggregationEnvelope<T> hit = cached.as(resultType);
                memoryHits.incrementAndGet();
                logger.debug("Memory hit for {}", cacheKey);
                return Optional.of(new CacheRetrievalResult<>(
                        hit.withSource(AggregationSource.MEMORY), AggregationSource.MEMORY));
            }
            memory.remove(cacheKey, cached);
            logger.debug("Evicted stale memory entry for {}", cacheKey);
        }

        Optional<AggregationEnvelope<T>> durable = readDurable(key, resultType);
        if (durable.isPresent() && !durable.get().isExpiredAt(now)) {
            AggregationEnvelope<T> envelope = durable.get();
            memory.put(cacheKey, envelope);
            durableHits.incrementAndGet();
            logger.debug("Durable hit for {}, promoted to memory", cacheKey);
            return Optional.of(new CacheRetrievalResult<>(envelope, AggregationSource.DURABLE));
        }

        misses.incrementAndGet();
        logger.debug("Cache miss for {}", cacheKey);
        return Optional.empty();
    }

    @Override
    public void set(AggregationKey key, AggregationEnvelope<?> envelope) {
        String cacheKey = key.toCacheKey();
        memory.put(cacheKey, envelope);

        try {
            storage.storeAggregation(key, envelope);
        } catch (Exception e) {
            durableErrors.incrementAndGet();
            logger.warn("Durable write failed for {}, keeping memory copy only: {}", cacheKey, e.getMessage());
        }
    }

    @Override
    public void delete(AggregationKey key) {
        String cacheKey = key.toCacheKey();
        memory.remove(cacheKey);

        try {
            storage.removeAggregation(key);
        } catch (Exception e) {
            durableErrors.incrementAndGet();
            logger.warn("Durable delete failed for {}: {}", cacheKey, e.getMessage());
        }
    }

    @Override
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;

        for (Map.Entry<String, AggregationEnvelope<?>> entry : memory.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && memory.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }

        try {
            List<AggregationKey> expired = storage.listExpired(now);
            for (AggregationKey key : expired) {
                storage.removeAggregation(key);
                removed++;
            }
        } catch (Exception e) {
            durableErrors.incrementAndGet();
            logger.warn("Durable sweep failed: {}", e.getMessage());
        }

        logger.debug("Swept {} expired aggregation entries", removed);
        return removed;
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(
                memoryHits.get(),
                durableHits.get(),
                misses.get(),
                durableErrors.get(),
                memory.size()
        );
    }

    private <T> Optional<AggregationEnvelope<T>> readDurable(AggregationKey key, Class<T> resultType) {
        try {
            return storage.getAggregation(key, resultType);
        } catch (Exception e) {
            durableErrors.incrementAndGet();
            logger.warn("Durable read failed for {}, treating as miss: {}", key.toCacheKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isAssignable(AggregationEnvelope<?> envelope, Class<?> resultType) {
        return envelope.data() == null || resultType.isInstance(envelope.data());
    }
}
