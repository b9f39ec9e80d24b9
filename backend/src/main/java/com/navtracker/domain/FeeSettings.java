package com.navtracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Inputs of the monthly NAV fee waterfall. Rates are fractions (0.25 = 25%) except hurdleRate, which is a percentage.
 * netFlows is signed: deposits positive, withdrawals negative.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class FeeSettings {

    private BigDecimal annualExpense = BigDecimal.ZERO;
    private BigDecimal monthlyExpense = BigDecimal.ZERO;
    private BigDecimal priorPreFeeNav = BigDecimal.ZERO;
    private PriorNavSource priorPreFeeNavSource = PriorNavSource.MANUAL;
    private BigDecimal netFlows = BigDecimal.ZERO;
    private BigDecimal hurdleRate = BigDecimal.ZERO;
    private HurdleRateType hurdleRateType = HurdleRateType.ANNUAL;
    private BigDecimal highWaterMark = BigDecimal.ZERO;
    private BigDecimal performanceFeeRate = BigDecimal.ZERO;
    private BigDecimal accruedPerformanceFeeRate = BigDecimal.ZERO;
    private FeePaymentStatus feePaymentStatus = FeePaymentStatus.NOT_PAID;
    private BigDecimal partialPaymentAmount = BigDecimal.ZERO;

    public FeeSettings copy() {
        FeeSettings copy = new FeeSettings();
        copy.annualExpense = annualExpense;
        copy.monthlyExpense = monthlyExpense;
        copy.priorPreFeeNav = priorPreFeeNav;
        copy.priorPreFeeNavSource = priorPreFeeNavSource;
        copy.netFlows = netFlows;
        copy.hurdleRate = hurdleRate;
        copy.hurdleRateType = hurdleRateType;
        copy.highWaterMark = highWaterMark;
        copy.performanceFeeRate = performanceFeeRate;
        copy.accruedPerformanceFeeRate = accruedPerformanceFeeRate;
        copy.feePaymentStatus = feePaymentStatus;
        copy.partialPaymentAmount = partialPaymentAmount;
        return copy;
    }
}
