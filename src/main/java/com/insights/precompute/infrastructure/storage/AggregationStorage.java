package com.insights.precompute.infrastructure.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insights.precompute.domain.model.AggregationEnvelope;
import com.insights.precompute.domain.model.AggregationKey;
import com.insights.precompute.domain.model.AggregationSource;
import com.insights.precompute.domain.model.StoredAggregationRecord;
import com.insights.precompute.domain.port.out.AggregationStorageAdapter;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable tier: converts envelopes to and from the stored record shape.
 * The only component that talks to the storage adapter.
 */
@Component
public class AggregationStorage {

    private final AggregationStorageAdapter adapter;
    private final ObjectMapper objectMapper;

    public AggregationStorage(AggregationStorageAdapter adapter, ObjectMapper objectMapper) {
        this.adapter = adapter;
        this.objectMapper = objectMapper;
    }

    public void storeAggregation(AggregationKey key, AggregationEnvelope<?> envelope) {
        adapter.store(toRecord(key, envelope));
    }

    public <T> Optional<AggregationEnvelope<T>> getAggregation(AggregationKey key, Class<T> resultType) {
        return adapter.fetch(key).map(record -> fromRecord(record, resultType));
    }

    public void removeAggregation(AggregationKey key) {
        adapter.remove(key);
    }

    public List<AggregationKey> listExpired(Instant reference) {
        return adapter.fetchExpired(reference).stream()
                .map(StoredAggregationRecord::key)
                .toList();
    }

    StoredAggregationRecord<JsonNode> toRecord(AggregationKey key, AggregationEnvelope<?> envelope) {
        return new StoredAggregationRecord<>(
                null,
                key.userId(),
                key.aggregationType(),
                key.filterHash(),
                objectMapper.valueToTree(envelope.data()),
                envelope.computedAt().toString(),
                envelope.expiresAt().toString(),
                envelope.version(),
                envelope.metadata()
        );
    }

    <T> AggregationEnvelope<T> fromRecord(StoredAggregationRecord<JsonNode> record, Class<T> resultType) {
        try {
            T data = record.data() == null || record.data().isNull()
                    ? null
                    : objectMapper.treeToValue(record.data(), resultType);

            return new AggregationEnvelope<>(
                    data,
                    Instant.parse(record.computedAt()),
                    Instant.parse(record.expiresAt()),
                    record.version(),
                    record.metadata(),
                    AggregationSource.DURABLE
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored aggregation " + record.key().toCacheKey()
                    + " does not decode as " + resultType.getSimpleName(), e);
        }
    }
}
