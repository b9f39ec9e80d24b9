package com.navtracker.common;

import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Calendar month a NAV report belongs to. Month is 1-based.
 */
public record ReportingPeriod(int year, int month) implements Comparable<ReportingPeriod> {

    public static final int MIN_YEAR = 2000;
    public static final int MAX_YEAR = 2100;

    public ReportingPeriod {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be between 1 and 12, got " + month);
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", got " + year);
        }
    }

    public static ReportingPeriod of(YearMonth yearMonth) {
        return new ReportingPeriod(yearMonth.getYear(), yearMonth.getMonthValue());
    }

    /** January rolls back to December of the previous year. */
    public ReportingPeriod prior() {
        return of(toYearMonth().minusMonths(1));
    }

    public YearMonth toYearMonth() {
        return YearMonth.of(year, month);
    }

    public String monthName() {
        return monthName(month);
    }

    public static String monthName(int month) {
        return Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    @Override
    public int compareTo(ReportingPeriod other) {
        return toYearMonth().compareTo(other.toYearMonth());
    }

    @Override
    public String toString() {
        return toYearMonth().toString();
    }
}
