package com.navtracker.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * One daily snapshot in a history response; token and position lists are left out.
 */
public record SnapshotPointResponse(
        String walletAddress,
        String day,
        Instant date,
        BigDecimal totalNavUsd,
        BigDecimal tokensNavUsd,
        BigDecimal positionsNavUsd,
        BigDecimal unclaimedRewardsUsd,
        Map<String, BigDecimal> chainDistribution,
        Map<String, BigDecimal> protocolDistribution
) {
}
