package com.insights.precompute.infrastructure.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the aggregation cache tiers
 * TTLs are resolved per aggregation type, falling back to the default TTL
 */
@Component
@ConfigurationProperties(prefix = "aggregation.cache")
public class AggregationCacheConfig {

    private Duration defaultTtl = Duration.ofMinutes(15);
    private Map<String, Duration> ttlOverrides = new HashMap<>();
    private int schemaVersion = 1;
    private String keyPrefix = "insights:aggregation:";
    private Duration durableRetention = Duration.ofHours(24);

    public Duration resolveTtl(String aggregationType) {
        return ttlOverrides.getOrDefault(aggregationType, defaultTtl);
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Map<String, Duration> getTtlOverrides() {
        return ttlOverrides;
    }

    public void setTtlOverrides(Map<String, Duration> ttlOverrides) {
        this.ttlOverrides = ttlOverrides;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Duration getDurableRetention() {
        return durableRetention;
    }

    public void setDurableRetention(Duration durableRetention) {
        this.durableRetention = durableRetention;
    }
}
