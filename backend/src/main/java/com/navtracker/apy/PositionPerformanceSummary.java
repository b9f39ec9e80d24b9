package com.navtracker.apy;

import java.time.LocalDate;
import java.util.List;

/**
 * The largest positions by current value with their APY over the period.
 */
public record PositionPerformanceSummary(
        String userId,
        LocalDate targetDate,
        int periodDays,
        List<ApyResult> positions,
        int totalPositions,
        int displayedPositions
) {

    public PositionPerformanceSummary {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
