package com.navtracker.ingestion.refresh;

import com.navtracker.domain.DailySnapshot;

/**
 * Outcome for one wallet. When degraded, snapshot is the last stored one (or null if none exists) and nothing was
 * written for this refresh.
 */
public record WalletRefreshResult(
        String walletAddress,
        DailySnapshot snapshot,
        boolean degraded,
        String degradedReason,
        long positionsDeactivated
) {

    public static WalletRefreshResult live(String walletAddress, DailySnapshot snapshot, long positionsDeactivated) {
        return new WalletRefreshResult(walletAddress, snapshot, false, null, positionsDeactivated);
    }

    public static WalletRefreshResult degraded(String walletAddress, DailySnapshot lastKnownGood, String reason) {
        return new WalletRefreshResult(walletAddress, lastKnownGood, true, reason, 0);
    }
}
