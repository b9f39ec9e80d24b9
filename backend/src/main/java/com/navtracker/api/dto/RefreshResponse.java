package com.navtracker.api.dto;

import java.math.BigDecimal;
import java.util.List;

public record RefreshResponse(
        String userId,
        BigDecimal totalNavUsd,
        long degradedCount,
        List<WalletRefreshSummary> wallets
) {
}
