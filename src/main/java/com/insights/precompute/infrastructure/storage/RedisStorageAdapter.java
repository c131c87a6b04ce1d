package com.insights.precompute.infrastructure.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.StoredAggregationRecord;
import com.insights.precompute.domain.port.out.AggregationStorageAdapter;
import com.insights.precompute.infrastructure.cache.AggregationCacheConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed storage adapter.
 * Records are JSON strings; a sorted set scored by expiry time indexes them for sweeps.
 * Keys outlive their expiry by the configured retention so expired entries stay listable.
 */
@Repository
@ConditionalOnProperty(name = "aggregation.storage.type", havingValue = "redis", matchIfMissing = true)
public class RedisStorageAdapter implements AggregationStorageAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RedisStorageAdapter.class);
    private static final TypeReference<StoredAggregationRecord<JsonNode>> RECORD_TYPE = new TypeReference<>() {};

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final AggregationCacheConfig config;
    private final Clock clock;

    public RedisStorageAdapter(RedisTemplate<String, String> redisTemplate,
                               ObjectMapper objectMapper,
                               AggregationCacheConfig config,
                               Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
    }

    @Override
    @CircuitBreaker(name = "aggregation-storage")
    public void store(StoredAggregationRecord<JsonNode> record) {
        String redisKey = redisKey(record.key());
        Instant expiresAt = Instant.parse(record.expiresAt());

        try {
            String json = objectMapper.writeValueAsString(record.withId(redisKey));
            Duration ttl = Duration.between(clock.instant(), expiresAt).plus(config.getDurableRetention());
            if (ttl.isNegative() || ttl.isZero()) {
                logger.debug("Skipping store of {}, already past retention", redisKey);
                return;
            }

            redisTemplate.opsForValue().set(redisKey, json, ttl);
            redisTemplate.opsForZSet().add(expiryIndexKey(), redisKey, expiresAt.toEpochMilli());
            logger.debug("Stored aggregation {} (expires {})", redisKey, expiresAt);

        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize aggregation " + redisKey, e);
        }
    }

    @Override
    @CircuitBreaker(name = "aggregation-storage")
    public Optional<StoredAggregationRecord<JsonNode>> fetch(AggregationKey key) {
        String json = redisTemplate.opsForValue().get(redisKey(key));
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parse(json));
    }

    @Override
    @CircuitBreaker(name = "aggregation-storage")
    public void remove(AggregationKey key) {
        String redisKey = redisKey(key);
        redisTemplate.delete(redisKey);
        redisTemplate.opsForZSet().remove(expiryIndexKey(), redisKey);
    }

    @Override
    @CircuitBreaker(name = "aggregation-storage")
    public List<StoredAggregationRecord<JsonNode>> fetchExpired(Instant reference) {
        Set<String> keys = redisTemplate.opsForZSet()
                .rangeByScore(expiryIndexKey(), 0, reference.toEpochMilli());
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }

        List<String> redisKeys = new ArrayList<>(keys);
        List<String> values = redisTemplate.opsForValue().multiGet(redisKeys);
        List<StoredAggregationRecord<JsonNode>> expired = new ArrayList<>();

        for (int i = 0; i < redisKeys.size(); i++) {
            String json = values != null ? values.get(i) : null;
            if (json == null) {
                // evicted by Redis TTL, drop the dangling index entry
                redisTemplate.opsForZSet().remove(expiryIndexKey(), redisKeys.get(i));
                continue;
            }
            try {
                expired.add(parse(json));
            } catch (IllegalStateException e) {
                logger.warn("Skipping unreadable aggregation {}: {}", redisKeys.get(i), e.getMessage());
            }
        }
        return expired;
    }

    private StoredAggregationRecord<JsonNode> parse(String json) {
        try {
            return objectMapper.readValue(json, RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted aggregation record: " + e.getOriginalMessage(), e);
        }
    }

    private String redisKey(AggregationKey key) {
        return config.getKeyPrefix() + key.toCacheKey();
    }

    private String expiryIndexKey() {
        return config.getKeyPrefix() + "expiry-index";
    }
}
