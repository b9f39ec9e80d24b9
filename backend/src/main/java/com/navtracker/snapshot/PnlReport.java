package com.navtracker.snapshot;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Change of total portfolio value since the previous report of the given cadence.
 * pnlPercentage is 100 when the previous value is 0 and the current one positive.
 */
public record PnlReport(
        ReportType reportType,
        boolean hasData,
        BigDecimal currentValue,
        BigDecimal previousValue,
        BigDecimal pnlAmount,
        BigDecimal pnlPercentage,
        Instant currentDate,
        Instant previousDate
) {
}
