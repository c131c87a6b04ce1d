package com.insights.precompute.infrastructure.web;

import com.insights.precompute.domain.model.FeatureFlag;
import com.insights.precompute.domain.model.FeatureFlagState;
import com.insights.precompute.infrastructure.flags.FeatureFlagRegistry;
import com.insights.precompute.infrastructure.web.dto.ErrorResponse;
import com.insights.precompute.infrastructure.web.dto.FlagOverrideRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Operator endpoints for reading and overriding feature flags at runtime
 */
@RestController
@RequestMapping("/admin/flags")
public class FeatureFlagController {

    private static final Logger logger = LoggerFactory.getLogger(FeatureFlagController.class);

    private final FeatureFlagRegistry flagRegistry;

    public FeatureFlagController(FeatureFlagRegistry flagRegistry) {
        this.flagRegistry = flagRegistry;
    }

    @GetMapping
    public ResponseEntity<Map<String, FeatureFlagState>> listFlags() {
        Map<String, FeatureFlagState> response = new LinkedHashMap<>();
        flagRegistry.listAll().forEach((flag, state) -> response.put(flag.key(), state));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{flag}")
    public ResponseEntity<?> getFlag(@PathVariable("flag") String flagName) {
        Optional<FeatureFlag> flag = FeatureFlag.fromKey(flagName);
        if (flag.isEmpty()) {
            return unknownFlag(flagName);
        }
        return ResponseEntity.ok(flagRegistry.getState(flag.get()));
    }

    @PutMapping("/{flag}")
    public ResponseEntity<?> overrideFlag(@PathVariable("flag") String flagName,
                                          @Valid @RequestBody FlagOverrideRequest request) {
        Optional<FeatureFlag> flag = FeatureFlag.fromKey(flagName);
        if (flag.isEmpty()) {
            return unknownFlag(flagName);
        }

        logger.info("Operator override: {}={}", flag.get().key(), request.enabled());
        flagRegistry.setRuntimeOverride(flag.get(), request.enabled());
        return ResponseEntity.ok(flagRegistry.getState(flag.get()));
    }

    @DeleteMapping("/overrides")
    public ResponseEntity<Void> clearOverrides() {
        flagRegistry.clearRuntimeOverrides();
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<ErrorResponse> unknownFlag(String flagName) {
        logger.warn("Unknown feature flag requested: {}", flagName);
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("unknown_flag", "Unknown feature flag: " + flagName));
    }
}
