package com.navtracker.snapshot;

import java.time.ZonedDateTime;

/**
 * Cadence of "last report" comparisons.
 */
public enum ReportType {
    DAILY,
    WEEKLY,
    MONTHLY;

    public ZonedDateTime lookbackFrom(ZonedDateTime now) {
        return switch (this) {
            case DAILY -> now.minusDays(1);
            case WEEKLY -> now.minusWeeks(1);
            case MONTHLY -> now.minusMonths(1);
        };
    }
}
