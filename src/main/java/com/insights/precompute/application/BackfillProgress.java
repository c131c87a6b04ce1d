package com.insights.precompute.application;

public record BackfillProgress(
        String userId,
        String aggregationType,
        int processed,
        int total
) {}
