package com.insights.precompute.infrastructure.flags;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insights.precompute.domain.model.FeatureFlag;
import com.insights.precompute.domain.model.FeatureFlagState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves feature flags with precedence runtime override > environment override > built-in default.
 * Environment overrides are parsed once, from a JSON object of flag key to boolean.
 */
@Component
public class FeatureFlagRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FeatureFlagRegistry.class);

    private final Clock clock;
    private final Map<FeatureFlag, FeatureFlagState> defaults;
    private final Map<FeatureFlag, FeatureFlagState> envOverrides;
    private final Map<FeatureFlag, FeatureFlagState> runtimeOverrides = new ConcurrentHashMap<>();

    public FeatureFlagRegistry(@Value("${aggregation.flags.overrides:}") String rawEnvOverrides,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.clock = clock;
        this.defaults = stampDefaults(clock);
        this.envOverrides = parseEnvOverrides(rawEnvOverrides, objectMapper);
        logger.info("Feature flags resolved at startup: {}", listAll());
    }

    public boolean isEnabled(FeatureFlag flag) {
        return getState(flag).enabled();
    }

    public FeatureFlagState getState(FeatureFlag flag) {
        FeatureFlagState runtime = runtimeOverrides.get(flag);
        if (runtime != null) {
            return runtime;
        }

        FeatureFlagState env = envOverrides.get(flag);
        if (env != null) {
            return env;
        }

        return defaults.get(flag);
    }

    public void setRuntimeOverride(FeatureFlag flag, boolean enabled) {
        runtimeOverrides.put(flag, new FeatureFlagState(enabled, clock.instant(), FeatureFlagState.Source.RUNTIME));
        logger.info("Runtime override set: {}={}", flag.key(), enabled);
    }

    public void clearRuntimeOverrides() {
        runtimeOverrides.clear();
        logger.info("Runtime flag overrides cleared");
    }

    public Map<FeatureFlag, FeatureFlagState> listAll() {
        Map<FeatureFlag, FeatureFlagState> all = new LinkedHashMap<>();
        for (FeatureFlag flag : FeatureFlag.values()) {
            all.put(flag, getState(flag));
        }
        return all;
    }

    private static Map<FeatureFlag, FeatureFlagState> stampDefaults(Clock clock) {
        Map<FeatureFlag, FeatureFlagState> stamped = new EnumMap<>(FeatureFlag.class);
        for (FeatureFlag flag : FeatureFlag.values()) {
            stamped.put(flag, new FeatureFlagState(flag.defaultValue(), clock.instant(), FeatureFlagState.Source.DEFAULT));
        }
        return Collections.unmodifiableMap(stamped);
    }

    private Map<FeatureFlag, FeatureFlagState> parseEnvOverrides(String raw, ObjectMapper objectMapper) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyMap();
        }

        try {
            JsonNode root = objectMapper.readTree(raw);
            if (root == null || !root.isObject()) {
                logger.warn("Ignoring flag overrides, expected a JSON object but got: {}", raw);
                return Collections.emptyMap();
            }

            Map<FeatureFlag, FeatureFlagState> parsed = new EnumMap<>(FeatureFlag.class);
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Optional<FeatureFlag> flag = FeatureFlag.fromKey(field.getKey());

                if (flag.isEmpty()) {
                    logger.warn("Ignoring unknown feature flag override: {}", field.getKey());
                } else if (!field.getValue().isBoolean()) {
                    logger.warn("Ignoring non-boolean override for {}: {}", field.getKey(), field.getValue());
                } else {
                    parsed.put(flag.get(), new FeatureFlagState(
                            field.getValue().booleanValue(), clock.instant(), FeatureFlagState.Source.ENV));
                }
            }
            return Collections.unmodifiableMap(parsed);

        } catch (Exception e) {
            logger.warn("Failed to parse feature flag overrides, using defaults: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
