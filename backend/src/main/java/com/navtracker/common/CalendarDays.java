package com.navtracker.common;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Calendar-day arithmetic in a reference zone. The day key is the ISO date (yyyy-MM-dd).
 */
public final class CalendarDays {

    private CalendarDays() {
    }

    public static String dayKey(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate().toString();
    }

    public static Instant startOfDay(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).toInstant();
    }

    /** Last representable instant of the day (inclusive bound for queries). */
    public static Instant endOfDay(LocalDate day, ZoneId zone) {
        return day.plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1);
    }
}
