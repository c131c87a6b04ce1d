package com.insights.precompute.infrastructure.persistence;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Translates a timeframe filter value into the earliest watch time it admits.
 * Rolling windows use 30-day months.
 */
public final class TimeframeWindow {

    private static final Duration MONTH = Duration.ofDays(30);

    private TimeframeWindow() {
    }

    public static Optional<Instant> lowerBound(String timeframe, Clock clock) {
        if (timeframe == null) {
            return Optional.empty();
        }

        LocalDate today = LocalDate.now(clock);
        return switch (timeframe) {
            case "MTD" -> Optional.of(startOf(today.withDayOfMonth(1), clock));
            case "QTD" -> {
                int firstMonthOfQuarter = ((today.getMonthValue() - 1) / 3) * 3 + 1;
                yield Optional.of(startOf(LocalDate.of(today.getYear(), firstMonthOfQuarter, 1), clock));
            }
            case "YTD" -> Optional.of(startOf(today.withDayOfYear(1), clock));
            case "Last6M" -> Optional.of(clock.instant().minus(MONTH.multipliedBy(6)));
            case "Last12M" -> Optional.of(clock.instant().minus(MONTH.multipliedBy(12)));
            default -> Optional.empty();
        };
    }

    private static Instant startOf(LocalDate date, Clock clock) {
        return date.atStartOfDay(clock.getZone()).toInstant();
    }
}
