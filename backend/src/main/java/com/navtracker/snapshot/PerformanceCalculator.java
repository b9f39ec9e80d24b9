package com.navtracker.snapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Performance figures of a value series ordered oldest first. Pure.
 */
final class PerformanceCalculator {

    private static final double DAYS_PER_YEAR = 365.0;
    private static final int SCALE = 6;

    private PerformanceCalculator() {
    }

    static PortfolioPerformance measure(int periodDays, String walletAddress, List<BigDecimal> values, double riskFreeRate) {
        BigDecimal start = values.isEmpty() ? BigDecimal.ZERO : values.get(0);
        BigDecimal end = values.isEmpty() ? BigDecimal.ZERO : values.get(values.size() - 1);
        List<Double> returns = dailyReturns(values);
        if (returns.isEmpty()) {
            return new PortfolioPerformance(periodDays, walletAddress, values.size(), start, end,
                    BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                    List.of());
        }
        List<String> warnings = new ArrayList<>();
        double growth = 1.0;
        double sum = 0;
        int wins = 0;
        for (double r : returns) {
            growth *= 1 + r;
            sum += r;
            if (r > 0) {
                wins++;
            }
        }
        double mean = sum / returns.size();
        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        variance /= returns.size();
        double volatility = Math.sqrt(variance) * Math.sqrt(DAYS_PER_YEAR);
        double annualized = Math.pow(1 + mean, DAYS_PER_YEAR) - 1;
        BigDecimal annualizedReturn = null;
        BigDecimal sharpe = BigDecimal.ZERO;
        if (Double.isFinite(annualized)) {
            annualizedReturn = fraction(annualized);
            if (volatility != 0) {
                sharpe = fraction((annualized - riskFreeRate) / volatility);
            }
        } else {
            warnings.add("Annualized return overflows; mean daily return is " + fraction(mean).toPlainString());
        }
        return new PortfolioPerformance(periodDays, walletAddress, values.size(), start, end,
                fraction(growth - 1), annualizedReturn, fraction(volatility), sharpe,
                fraction(maxDrawdown(values)), fraction((double) wins / returns.size()), warnings);
    }

    /**
     * Day-over-day returns; a day whose predecessor is not positive has no return.
     */
    static List<Double> dailyReturns(List<BigDecimal> values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            double previous = values.get(i - 1).doubleValue();
            if (previous > 0) {
                returns.add(values.get(i).doubleValue() / previous - 1);
            }
        }
        return returns;
    }

    static double maxDrawdown(List<BigDecimal> values) {
        double peak = 0;
        double worst = 0;
        for (BigDecimal value : values) {
            double v = value.doubleValue();
            peak = Math.max(peak, v);
            if (peak > 0) {
                worst = Math.max(worst, (peak - v) / peak);
            }
        }
        return worst;
    }

    private static BigDecimal fraction(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
