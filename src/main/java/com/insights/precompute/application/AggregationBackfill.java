package com.insights.precompute.application;

import com.insights.precompute.domain.model.FeatureFlag;
import com.insights.precompute.domain.model.FilterOptions;
import com.insights.precompute.infrastructure.flags.FeatureFlagRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Forces recomputation over aggregation types x filter sets, in fixed-size batches.
 * Runs sequentially so downstream compute load stays bounded. Never uses a fallback:
 * a failing primary compute aborts the run.
 */
@Service
public class AggregationBackfill {

    private static final Logger logger = LoggerFactory.getLogger(AggregationBackfill.class);

    private final AggregationService aggregationService;
    private final FeatureFlagRegistry flags;

    public AggregationBackfill(AggregationService aggregationService, FeatureFlagRegistry flags) {
        this.aggregationService = aggregationService;
        this.flags = flags;
    }

    public BackfillResult run(BackfillConfig config) {
        int total = config.totalWork();

        if (total == 0) {
            logger.debug("Nothing to backfill for user {}", config.userId());
            return new BackfillResult(0, 0, false);
        }

        if (!flags.isEnabled(FeatureFlag.PRECOMPUTATION_BACKFILL)) {
            logger.warn("Backfill disabled by feature flag, skipping {} refreshes for user {}", total, config.userId());
            return BackfillResult.skipped(total);
        }

        logger.info("Starting backfill for user {}: {} types x {} filter sets",
                config.userId(), config.aggregationTypes().size(), config.filterSets().size());

        int processed = 0;
        for (List<FilterOptions> batch : chunk(config.filterSets(), config.batchSize())) {
            for (String type : config.aggregationTypes()) {
                for (FilterOptions filters : batch) {
                    aggregationService.refreshAggregation(AggregationRequest.of(config.userId(), type, filters));

                    processed++;
                    if (config.onProgress() != null) {
                        config.onProgress().accept(new BackfillProgress(config.userId(), type, processed, total));
                    }
                }
            }
            logger.debug("Backfill progress for user {}: {}/{}", config.userId(), processed, total);
        }

        logger.info("Backfill completed for user {}: {} aggregations refreshed", config.userId(), processed);
        return new BackfillResult(processed, total, false);
    }

    static <T> List<List<T>> chunk(List<T> items, int size) {
        int safeSize = Math.max(1, size);
        List<List<T>> chunks = new ArrayList<>();
        for (int index = 0; index < items.size(); index += safeSize) {
            chunks.add(items.subList(index, Math.min(items.size(), index + safeSize)));
        }
        return chunks;
    }
}
