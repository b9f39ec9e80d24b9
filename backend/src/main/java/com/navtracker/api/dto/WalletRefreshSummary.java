package com.navtracker.api.dto;

import java.math.BigDecimal;

/**
 * One wallet of a refresh response. Totals are null when the wallet is degraded and has never been stored.
 */
public record WalletRefreshSummary(
        String walletAddress,
        String day,
        BigDecimal totalNavUsd,
        BigDecimal tokensNavUsd,
        BigDecimal positionsNavUsd,
        BigDecimal unclaimedRewardsUsd,
        int tokenCount,
        int positionCount,
        boolean degraded,
        String degradedReason,
        long positionsDeactivated
) {
}
