package com.navtracker.ingestion.store;

import com.navtracker.common.CalendarDays;
import com.navtracker.domain.DailySnapshot;
import com.navtracker.domain.DailySnapshotRepository;
import com.navtracker.ingestion.enrichment.EnrichedWallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Writes the daily snapshot of a wallet. One row per (userId, walletAddress, day) in the reference clock's zone:
 * the first refresh of a day inserts it, later refreshes the same day overwrite it (last write wins).
 * The write is a single atomic upsert against a unique index, so concurrent refreshes cannot create two rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotStore {

    private final DailySnapshotRepository dailySnapshotRepository;
    private final Clock clock;

    /**
     * @throws SnapshotPersistenceException when the write fails
     */
    public DailySnapshot upsertSnapshot(String userId, String walletAddress, EnrichedWallet wallet) {
        Instant now = clock.instant();
        DailySnapshot snapshot = new DailySnapshot();
        snapshot.setUserId(userId);
        snapshot.setWalletAddress(walletAddress);
        snapshot.setDay(CalendarDays.dayKey(now, clock.getZone()));
        snapshot.setDate(now);
        snapshot.setTokensNavUsd(wallet.tokensValue());
        snapshot.setPositionsNavUsd(wallet.positionsValue());
        snapshot.setTotalNavUsd(wallet.totalValue());
        snapshot.setUnclaimedRewardsUsd(wallet.unclaimedRewardsValue());
        snapshot.setTokens(wallet.tokens());
        snapshot.setPositions(wallet.positions());
        snapshot.setChainDistribution(wallet.chainDistribution());
        snapshot.setProtocolDistribution(wallet.protocolDistribution());
        snapshot.setCreatedAt(now);
        snapshot.setUpdatedAt(now);

        DailySnapshot stored;
        try {
            stored = dailySnapshotRepository.upsertDaily(snapshot);
        } catch (RuntimeException e) {
            throw new SnapshotPersistenceException(userId, walletAddress, e);
        }
        log.info("Snapshot upserted for user {} wallet {} day {}: total ${} ({} tokens, {} positions)",
                userId, walletAddress, snapshot.getDay(), snapshot.getTotalNavUsd(),
                snapshot.getTokens().size(), snapshot.getPositions().size());
        return stored != null ? stored : snapshot;
    }

    /**
     * Most recent stored snapshot of a wallet, used as last-known-good data when the upstream fetch fails.
     */
    public Optional<DailySnapshot> latestSnapshot(String userId, String walletAddress) {
        return dailySnapshotRepository.findFirstByUserIdAndWalletAddressOrderByDateDesc(userId, walletAddress);
    }
}
