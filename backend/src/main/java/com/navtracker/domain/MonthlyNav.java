package com.navtracker.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * NAV of one calendar month. month is the ISO year-month key ("2025-03"); monthlyReturn is the percentage change
 * against the previous entry, null for the oldest entry or when the previous NAV is not positive.
 */
@NoArgsConstructor
@Getter
@Setter
@Accessors(chain = true)
public class MonthlyNav {

    private String month;
    private Instant date;
    private BigDecimal nav = BigDecimal.ZERO;
    private BigDecimal monthlyReturn;
}
