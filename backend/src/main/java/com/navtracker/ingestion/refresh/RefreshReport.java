package com.navtracker.ingestion.refresh;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-wallet outcomes of one refresh request, in request order.
 */
public record RefreshReport(String userId, List<WalletRefreshResult> wallets) {

    public RefreshReport {
        wallets = wallets == null ? List.of() : List.copyOf(wallets);
    }

    public BigDecimal totalNavUsd() {
        return wallets.stream()
                .filter(w -> w.snapshot() != null)
                .map(w -> w.snapshot().getTotalNavUsd())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public long degradedCount() {
        return wallets.stream().filter(WalletRefreshResult::degraded).count();
    }
}
