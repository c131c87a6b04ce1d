package com.insights.precompute.application;

import com.insights.precompute.domain.model.FilterOptions;

import java.util.List;
import java.util.function.Consumer;

/**
 * Work description for one backfill run.
 *
 * @param batchSize  number of filter sets per batch, values below 1 are treated as 1
 * @param onProgress optional listener, invoked once per refreshed (type, filter set) pair
 */
public record BackfillConfig(
        String userId,
        List<String> aggregationTypes,
        List<FilterOptions> filterSets,
        int batchSize,
        Consumer<BackfillProgress> onProgress
) {
    public static final int DEFAULT_BATCH_SIZE = 10;

    public BackfillConfig {
        aggregationTypes = aggregationTypes != null ? List.copyOf(aggregationTypes) : List.of();
        filterSets = filterSets != null ? List.copyOf(filterSets) : List.of();
    }

    public int totalWork() {
        return aggregationTypes.size() * filterSets.size();
    }
}
