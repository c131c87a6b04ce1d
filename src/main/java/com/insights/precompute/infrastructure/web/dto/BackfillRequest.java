package com.insights.precompute.infrastructure.web.dto;

import com.insights.precompute.application.BackfillConfig;
import com.insights.precompute.domain.model.FilterOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record BackfillRequest(
        @NotBlank String userId,
        @NotNull List<String> aggregationTypes,
        @NotNull List<FilterOptions> filterSets,
        Integer batchSize
) {
    public BackfillConfig toConfig() {
        return new BackfillConfig(
                userId,
                aggregationTypes,
                filterSets,
                batchSize != null ? batchSize : BackfillConfig.DEFAULT_BATCH_SIZE,
                null
        );
    }
}
