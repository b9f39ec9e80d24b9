package com.navtracker.apy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Price-based APY of a token between periodStart and the current snapshot. apy and priceReturn are percentages;
 * apy is null when compounding overflows.
 */
public record TokenApyPeriod(
        BigDecimal apy,
        BigDecimal priceReturn,
        int days,
        ApyConfidence confidence,
        List<String> warnings,
        BigDecimal currentPrice,
        BigDecimal historicalPrice,
        BigDecimal priceChange,
        Instant periodStart
) {

    public TokenApyPeriod {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
