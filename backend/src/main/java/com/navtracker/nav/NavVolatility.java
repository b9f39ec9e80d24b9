package com.navtracker.nav;

import com.navtracker.domain.MonthlyNav;
import com.navtracker.domain.VolatilityMetrics;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Annualized volatility of a monthly NAV series: sample standard deviation of month-over-month returns (percent)
 * times sqrt(12). A return is only measured where the previous month's NAV is positive.
 */
public final class NavVolatility {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal SQRT_TWELVE = BigDecimal.valueOf(12).sqrt(MathContext.DECIMAL64);
    private static final int SCALE = 6;

    private NavVolatility() {
    }

    /**
     * Sets monthlyReturn on each entry and returns the metrics. Entries may come in any order.
     */
    public static VolatilityMetrics measure(List<MonthlyNav> history, Instant calculatedAt) {
        List<MonthlyNav> ascending = history.stream()
                .sorted(Comparator.comparing(MonthlyNav::getMonth))
                .toList();
        List<BigDecimal> returns = new ArrayList<>();
        for (int i = 0; i < ascending.size(); i++) {
            MonthlyNav entry = ascending.get(i);
            entry.setMonthlyReturn(null);
            if (i == 0) {
                continue;
            }
            BigDecimal previous = ascending.get(i - 1).getNav();
            if (previous != null && previous.signum() > 0) {
                BigDecimal monthlyReturn = entry.getNav().subtract(previous)
                        .multiply(HUNDRED)
                        .divide(previous, SCALE, RoundingMode.HALF_UP);
                entry.setMonthlyReturn(monthlyReturn);
                returns.add(monthlyReturn);
            }
        }
        VolatilityMetrics metrics = new VolatilityMetrics();
        metrics.setMonthlyReturns(returns);
        BigDecimal deviation = standardDeviation(returns);
        metrics.setStandardDeviation(deviation);
        metrics.setAnnualizedVolatility(deviation.multiply(SQRT_TWELVE).setScale(SCALE, RoundingMode.HALF_UP));
        metrics.setLastCalculated(calculatedAt);
        return metrics;
    }

    /**
     * Sample standard deviation (n - 1); 0 for fewer than two values.
     */
    static BigDecimal standardDeviation(List<BigDecimal> values) {
        if (values.size() < 2) {
            return BigDecimal.ZERO;
        }
        BigDecimal count = BigDecimal.valueOf(values.size());
        BigDecimal mean = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(count, MathContext.DECIMAL64);
        BigDecimal squares = values.stream()
                .map(v -> v.subtract(mean).pow(2))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal variance = squares.divide(count.subtract(BigDecimal.ONE), MathContext.DECIMAL64);
        return variance.sqrt(MathContext.DECIMAL64).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
