package com.navtracker.domain;

import java.util.List;

/**
 * Custom writes and queries for daily_snapshots.
 */
public interface DailySnapshotRepositoryCustom {

    /**
     * Atomic find-and-modify upsert on (userId, walletAddress, day). createdAt is written on insert only.
     * Returns the stored document after the write.
     */
    DailySnapshot upsertDaily(DailySnapshot snapshot);

    List<String> findDistinctWalletAddressesByUserId(String userId);
}
