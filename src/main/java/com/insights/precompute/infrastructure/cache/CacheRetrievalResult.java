package com.insights.precompute.infrastructure.cache;

import com.insights.precompute.domain.model.AggregationEnvelope;
import com.insights.precompute.domain.model.AggregationSource;

public record CacheRetrievalResult<T>(
        AggregationEnvelope<T> entry,
        AggregationSource hitLayer
) {}
