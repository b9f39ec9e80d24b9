package com.navtracker.apy;

import java.math.BigDecimal;

/**
 * Price APYs of one token held on the latest snapshot day. A period is null when no usable earlier price exists.
 * bestPeriod is the longest of monthly, weekly and daily that is not low confidence, or null.
 */
public record TokenApy(
        String symbol,
        String name,
        BigDecimal amount,
        BigDecimal currentPrice,
        BigDecimal currentValue,
        TokenApyPeriod daily,
        TokenApyPeriod weekly,
        TokenApyPeriod monthly,
        TokenApyPeriod allTime,
        BestPeriod bestPeriod,
        TokenRiskLevel riskLevel
) {

    public record BestPeriod(String period, BigDecimal apy, ApyConfidence confidence) {
    }
}
