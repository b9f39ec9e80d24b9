package com.navtracker.nav;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Defaults for fee settings of a month that has none yet. Documented in application.yml under navtracker.nav.
 */
@ConfigurationProperties(prefix = "navtracker.nav")
@Getter
@Setter
public class NavProperties {

    /**
     * Annual fund expense budget (USD).
     */
    private BigDecimal annualExpense = new BigDecimal("600");

    /**
     * Expense accrued each month (USD); becomes accruedExpenses in the waterfall.
     */
    private BigDecimal monthlyExpense = new BigDecimal("50");

    /**
     * Share of performance above the hurdle charged as fee (0.25 = 25%).
     */
    private BigDecimal performanceFeeRate = new BigDecimal("0.25");

    /**
     * Share of dividends receivable accrued as performance fee.
     */
    private BigDecimal accruedPerformanceFeeRate = new BigDecimal("0.25");

    /**
     * Hurdle rate in percent; 0 disables the hurdle.
     */
    private BigDecimal hurdleRate = BigDecimal.ZERO;

    /**
     * Number of months returned by the history endpoint when no limit is given.
     */
    private int historyLimit = 12;

    /**
     * Months kept in the monthly NAV series used for volatility; older months are dropped.
     */
    private int monthlyHistoryLimit = 24;
}
