package com.insights.precompute.infrastructure.cron;

import com.insights.precompute.infrastructure.cache.AggregationCacheStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "aggregation.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class ExpiredAggregationSweeper {

    private static final Logger logger = LoggerFactory.getLogger(ExpiredAggregationSweeper.class);
    private final AggregationCacheStrategy cache;

    public ExpiredAggregationSweeper(AggregationCacheStrategy cache) {
        this.cache = cache;
    }

    @Scheduled(fixedRateString = "${aggregation.sweep.interval-ms:300000}")
    public void sweep() {
        int removed = cache.sweepExpired();
        if (removed > 0) {
            logger.info("Removed {} expired aggregations. {}", removed, cache.getStats().summary());
        }
    }
}
