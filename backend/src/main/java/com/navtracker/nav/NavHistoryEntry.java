package com.navtracker.nav;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Headline figures of one stored month, for the NAV history view.
 */
public record NavHistoryEntry(
        int year,
        int month,
        String monthName,
        BigDecimal totalAssets,
        BigDecimal preFeeNav,
        BigDecimal performance,
        BigDecimal performanceFee,
        BigDecimal accruedPerformanceFees,
        BigDecimal netAssets,
        List<String> validationWarnings,
        Instant calculationDate
) {
}
