package com.insights.precompute.domain.model;

import java.util.List;

public record AggregationComputeContext(
        String userId,
        FilterOptions filters,
        List<WatchRecord> records
) {}
