package com.insights.precompute.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Raw watch-history event as loaded by a record source.
 */
public record WatchRecord(
        String id,
        Instant watchedAt,
        String videoId,
        String videoTitle,
        String channelTitle,
        String product,
        List<String> topics
) {}
