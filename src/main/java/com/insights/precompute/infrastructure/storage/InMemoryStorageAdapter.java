package com.insights.precompute.infrastructure.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.StoredAggregationRecord;
import com.insights.precompute.domain.port.out.AggregationStorageAdapter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local storage adapter, for single-node deployments and tests
 */
@Repository
@ConditionalOnProperty(name = "aggregation.storage.type", havingValue = "memory")
public class InMemoryStorageAdapter implements AggregationStorageAdapter {

    private final Map<String, StoredAggregationRecord<JsonNode>> records = new ConcurrentHashMap<>();

    @Override
    public void store(StoredAggregationRecord<JsonNode> record) {
        String id = record.key().toCacheKey();
        records.put(id, record.withId(id));
    }

    @Override
    public Optional<StoredAggregationRecord<JsonNode>> fetch(AggregationKey key) {
        return Optional.ofNullable(records.get(key.toCacheKey()));
    }

    @Override
    public void remove(AggregationKey key) {
        records.remove(key.toCacheKey());
    }

    @Override
    public List<StoredAggregationRecord<JsonNode>> fetchExpired(Instant reference) {
        return records.values().stream()
                .filter(record -> !Instant.parse(record.expiresAt()).isAfter(reference))
                .toList();
    }

    public int size() {
        return records.size();
    }
}
