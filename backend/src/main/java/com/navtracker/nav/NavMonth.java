package com.navtracker.nav;

import java.time.Instant;

/**
 * A month for which NAV settings exist.
 */
public record NavMonth(int year, int month, String monthName, Instant createdAt) {
}
