package com.navtracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outputs of the NAV fee waterfall. Field names are stable: the report renderer maps them 1:1 into rows.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class NavCalculations {

    private BigDecimal investments = BigDecimal.ZERO;
    private BigDecimal dividendsReceivable = BigDecimal.ZERO;
    private BigDecimal totalAssets = BigDecimal.ZERO;
    private BigDecimal accruedExpenses = BigDecimal.ZERO;
    private BigDecimal totalLiabilities = BigDecimal.ZERO;
    private BigDecimal preFeeNav = BigDecimal.ZERO;
    private BigDecimal performance = BigDecimal.ZERO;
    private BigDecimal hurdleAmount = BigDecimal.ZERO;
    private BigDecimal performanceFee = BigDecimal.ZERO;
    private BigDecimal accruedPerformanceFees = BigDecimal.ZERO;
    private BigDecimal netAssets = BigDecimal.ZERO;
    private BigDecimal netFlows = BigDecimal.ZERO;
    private BigDecimal priorPreFeeNav = BigDecimal.ZERO;
    private PriorNavSource priorPreFeeNavSource = PriorNavSource.MANUAL;
    private List<String> validationWarnings = new ArrayList<>();

    public List<String> getValidationWarnings() {
        return validationWarnings == null ? List.of() : Collections.unmodifiableList(validationWarnings);
    }

    public NavCalculations setValidationWarnings(List<String> validationWarnings) {
        this.validationWarnings = validationWarnings == null ? new ArrayList<>() : new ArrayList<>(validationWarnings);
        return this;
    }
}
