package com.insights.precompute.infrastructure.web;

import com.insights.precompute.application.AggregationBackfill;
import com.insights.precompute.application.AggregationRequest;
import com.insights.precompute.application.AggregationService;
import com.insights.precompute.application.BackfillResult;
import com.insights.precompute.domain.exception.AggregationNotRegisteredException;
import com.insights.precompute.domain.exception.AggregationValidationException;
import com.insights.precompute.domain.model.AggregationEnvelope;
import com.insights.precompute.domain.model.FilterOptions;
import com.insights.precompute.infrastructure.cache.AggregationCacheStrategy;
import com.insights.precompute.infrastructure.cache.CacheStats;
import com.insights.precompute.infrastructure.web.dto.BackfillRequest;
import com.insights.precompute.infrastructure.web.dto.ErrorResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator endpoints: manual refresh, invalidation, backfill and cache statistics
 */
@RestController
@RequestMapping("/admin/aggregations")
public class AggregationAdminController {

    private static final Logger logger = LoggerFactory.getLogger(AggregationAdminController.class);

    private final AggregationService aggregationService;
    private final AggregationBackfill backfill;
    private final AggregationCacheStrategy cache;

    public AggregationAdminController(AggregationService aggregationService,
                                      AggregationBackfill backfill,
                                      AggregationCacheStrategy cache) {
        this.aggregationService = aggregationService;
        this.backfill = backfill;
        this.cache = cache;
    }

    @PostMapping("/{type}/refresh")
    public ResponseEntity<?> refresh(
            @PathVariable("type") String type,
            @RequestParam("userId") @NotBlank String userId,
            @RequestParam(value = "timeframe", defaultValue = FilterOptions.ALL) String timeframe,
            @RequestParam(value = "product", defaultValue = FilterOptions.ALL) String product,
            @RequestParam(value = "topics", required = false) List<String> topics,
            @RequestParam(value = "channels", required = false) List<String> channels
    ) {
        FilterOptions filters = new FilterOptions(timeframe, product, topics, channels);

        try {
            AggregationEnvelope<Object> envelope =
                    aggregationService.refreshAggregation(AggregationRequest.of(userId, type, filters));
            return ResponseEntity.ok(envelope);

        } catch (AggregationNotRegisteredException e) {
            return error(HttpStatus.NOT_FOUND, "unknown_aggregation", e);
        } catch (AggregationValidationException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, "validation_failed", e);
        } catch (Exception e) {
            logger.error("Manual refresh of {} for user {} failed", type, userId, e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "compute_failed", e);
        }
    }

    @DeleteMapping("/{type}")
    public ResponseEntity<Void> clear(
            @PathVariable("type") String type,
            @RequestParam("userId") @NotBlank String userId,
            @RequestParam(value = "timeframe", defaultValue = FilterOptions.ALL) String timeframe,
            @RequestParam(value = "product", defaultValue = FilterOptions.ALL) String product,
            @RequestParam(value = "topics", required = false) List<String> topics,
            @RequestParam(value = "channels", required = false) List<String> channels
    ) {
        FilterOptions filters = new FilterOptions(timeframe, product, topics, channels);
        aggregationService.clearAggregation(AggregationRequest.of(userId, type, filters));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/backfill")
    public ResponseEntity<?> backfill(@Valid @RequestBody BackfillRequest request) {
        try {
            BackfillResult result = backfill.run(request.toConfig());
            return ResponseEntity.ok(result);

        } catch (AggregationNotRegisteredException e) {
            return error(HttpStatus.NOT_FOUND, "unknown_aggregation", e);
        } catch (Exception e) {
            logger.error("Backfill for user {} aborted", request.userId(), e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "backfill_failed", e);
        }
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(cache.getStats());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage()));
    }
}
