package com.navtracker.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Volatility of a monthly NAV series: monthly returns in percent, oldest first, their sample standard deviation and
 * the annualized figure (standard deviation x sqrt(12)). Both are 0 with fewer than two returns.
 */
@NoArgsConstructor
@Getter
@Setter
public class VolatilityMetrics {

    private List<BigDecimal> monthlyReturns = new ArrayList<>();
    private BigDecimal standardDeviation = BigDecimal.ZERO;
    private BigDecimal annualizedVolatility = BigDecimal.ZERO;
    private Instant lastCalculated;
}
