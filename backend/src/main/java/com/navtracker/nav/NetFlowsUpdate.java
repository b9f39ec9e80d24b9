package com.navtracker.nav;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of a net-flows update. walletAddress is null for the user-level figure.
 */
public record NetFlowsUpdate(
        String walletAddress,
        BigDecimal netFlows,
        BigDecimal previousNetFlows,
        BigDecimal totalNetFlows,
        long version,
        Instant lastUpdated
) {
}
