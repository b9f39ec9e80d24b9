package com.navtracker.snapshot;

import com.navtracker.domain.PortfolioTotals;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Portfolio aggregated over wallets as of a date.
 *
 * @param snapshotDays wallet -> day of the snapshot used (the requested day, or the latest before it)
 * @param exactMatch   true when every wallet had a snapshot on the requested day
 */
public record PortfolioAtDate(
        LocalDate date,
        PortfolioTotals totals,
        int tokenCount,
        int positionCount,
        Map<String, String> snapshotDays,
        boolean exactMatch
) {

    public BigDecimal totalNav() {
        return totals.totalValue();
    }
}
