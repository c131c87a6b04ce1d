package com.insights.precompute.application;

public record BackfillResult(
        int processed,
        int total,
        boolean skipped
) {
    public static BackfillResult skipped(int total) {
        return new BackfillResult(0, total, true);
    }
}
