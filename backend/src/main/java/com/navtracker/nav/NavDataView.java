package com.navtracker.nav;

import com.navtracker.domain.MonthlyNav;
import com.navtracker.domain.VolatilityMetrics;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read model of a user's NAV data. monthlyHistory is newest first; monthsOfData counts its entries.
 */
public record NavDataView(
        String userId,
        BigDecimal netFlows,
        Map<String, BigDecimal> walletNetFlows,
        BigDecimal totalNetFlows,
        BigDecimal priorPreFeeNav,
        BigDecimal currentPreFeeNav,
        BigDecimal performance,
        long version,
        Instant lastUpdated,
        VolatilityMetrics volatilityMetrics,
        int monthsOfData,
        List<MonthlyNav> monthlyHistory
) {
}
