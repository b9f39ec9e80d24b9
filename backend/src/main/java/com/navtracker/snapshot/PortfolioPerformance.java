package com.navtracker.snapshot;

import java.math.BigDecimal;
import java.util.List;

/**
 * Risk and return of the daily portfolio value series over a lookback period. All ratios are fractions
 * (0.05 = 5 %): totalReturn compounds the daily returns, annualizedReturn compounds their mean over 365 days,
 * volatility is the population standard deviation of daily returns times sqrt(365), maxDrawdown is the largest
 * peak-to-trough fall and winRate the share of positive days. Everything is 0 without at least two days of data.
 * annualizedReturn is null when it overflows; a warning says so.
 */
public record PortfolioPerformance(
        int periodDays,
        String walletAddress,
        int dataPoints,
        BigDecimal startValue,
        BigDecimal endValue,
        BigDecimal totalReturn,
        BigDecimal annualizedReturn,
        BigDecimal volatility,
        BigDecimal sharpeRatio,
        BigDecimal maxDrawdown,
        BigDecimal winRate,
        List<String> warnings
) {

    public PortfolioPerformance {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
