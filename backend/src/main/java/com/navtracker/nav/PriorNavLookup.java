package com.navtracker.nav;

import com.navtracker.domain.PriorNavSource;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of looking up the month before a reporting period. The prior* line items are null when nothing was found.
 */
public record PriorNavLookup(
        boolean found,
        BigDecimal priorPreFeeNav,
        PriorNavSource source,
        int priorYear,
        int priorMonth,
        String priorMonthName,
        String message,
        BigDecimal priorTotalAssets,
        BigDecimal priorNetAssets,
        BigDecimal priorPerformance,
        Instant priorCreatedAt
) {
}
