package com.navtracker.nav;

import com.navtracker.domain.FeePaymentStatus;
import com.navtracker.domain.FeeSettings;
import com.navtracker.domain.HurdleRateType;
import com.navtracker.domain.NavCalculations;
import com.navtracker.domain.PortfolioTotals;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monthly NAV waterfall: portfolio totals and fee settings in, line items out.
 * <p>
 * Pure: no clock, no I/O, no state. The same inputs always produce an equal result.
 * <pre>
 * investments         = tokens + positions - unclaimed rewards
 * dividendsReceivable = unclaimed rewards
 * totalAssets         = investments + dividendsReceivable
 * accruedExpenses     = monthlyExpense = totalLiabilities
 * preFeeNav           = totalAssets - accruedExpenses
 * performance         = preFeeNav - priorPreFeeNav + netFlows
 * netAssets           = preFeeNav - performanceFee - accruedPerformanceFees
 * </pre>
 * netFlows is added: withdrawals are negative and lower performance.
 */
@Component
@RequiredArgsConstructor
public class NavFeeEngine {

    static final int DIVISION_SCALE = 18;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private final NavValidator navValidator;

    public NavCalculations computeNav(PortfolioTotals totals, FeeSettings settings) {
        PortfolioTotals portfolio = totals != null ? totals : PortfolioTotals.ZERO;
        FeeSettings fees = settings != null ? settings : new FeeSettings();

        BigDecimal dividendsReceivable = portfolio.unclaimedRewardsValue();
        BigDecimal investments = portfolio.tokensValue().add(portfolio.positionsValue()).subtract(dividendsReceivable);
        BigDecimal totalAssets = investments.add(dividendsReceivable);
        BigDecimal accruedExpenses = nz(fees.getMonthlyExpense());
        BigDecimal totalLiabilities = accruedExpenses;
        BigDecimal preFeeNav = totalAssets.subtract(accruedExpenses);

        BigDecimal priorPreFeeNav = nz(fees.getPriorPreFeeNav());
        BigDecimal netFlows = nz(fees.getNetFlows());
        BigDecimal performance = preFeeNav.subtract(priorPreFeeNav).add(netFlows);

        BigDecimal hurdleAmount = hurdleAmount(nz(fees.getHurdleRate()), fees.getHurdleRateType(), priorPreFeeNav);
        BigDecimal performanceFee = performanceFee(performance, hurdleAmount, nz(fees.getPerformanceFeeRate()));
        BigDecimal accruedPerformanceFees = accruedPerformanceFees(dividendsReceivable, fees);
        BigDecimal netAssets = preFeeNav.subtract(performanceFee).subtract(accruedPerformanceFees);

        NavCalculations result = new NavCalculations();
        result.setInvestments(investments);
        result.setDividendsReceivable(dividendsReceivable);
        result.setTotalAssets(totalAssets);
        result.setAccruedExpenses(accruedExpenses);
        result.setTotalLiabilities(totalLiabilities);
        result.setPreFeeNav(preFeeNav);
        result.setPerformance(performance);
        result.setHurdleAmount(hurdleAmount);
        result.setPerformanceFee(performanceFee);
        result.setAccruedPerformanceFees(accruedPerformanceFees);
        result.setNetAssets(netAssets);
        result.setNetFlows(netFlows);
        result.setPriorPreFeeNav(priorPreFeeNav);
        result.setPriorPreFeeNavSource(fees.getPriorPreFeeNavSource());
        result.setValidationWarnings(navValidator.validate(performance, preFeeNav, priorPreFeeNav, netFlows));
        return result;
    }

    /**
     * Monthly hurdle in USD. An annual rate is spread over twelve months. Zero unless both rate and prior NAV are positive.
     */
    static BigDecimal hurdleAmount(BigDecimal hurdleRate, HurdleRateType type, BigDecimal priorPreFeeNav) {
        if (hurdleRate.signum() <= 0 || priorPreFeeNav.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal fraction = hurdleRate.divide(HUNDRED, DIVISION_SCALE, RoundingMode.HALF_UP);
        if (type != HurdleRateType.MONTHLY) {
            fraction = fraction.divide(MONTHS_PER_YEAR, DIVISION_SCALE, RoundingMode.HALF_UP);
        }
        return fraction.multiply(priorPreFeeNav);
    }

    static BigDecimal performanceFee(BigDecimal performance, BigDecimal hurdleAmount, BigDecimal feeRate) {
        if (performance.compareTo(hurdleAmount) <= 0) {
            return BigDecimal.ZERO;
        }
        return performance.subtract(hurdleAmount).multiply(feeRate);
    }

    static BigDecimal accruedPerformanceFees(BigDecimal dividendsReceivable, FeeSettings fees) {
        FeePaymentStatus status = fees.getFeePaymentStatus() != null ? fees.getFeePaymentStatus() : FeePaymentStatus.NOT_PAID;
        BigDecimal calculated = dividendsReceivable.multiply(nz(fees.getAccruedPerformanceFeeRate()));
        return switch (status) {
            case PAID -> BigDecimal.ZERO;
            case NOT_PAID -> calculated;
            case PARTIALLY_PAID -> calculated.subtract(nz(fees.getPartialPaymentAmount())).max(BigDecimal.ZERO);
        };
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
