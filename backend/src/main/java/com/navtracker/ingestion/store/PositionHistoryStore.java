package com.navtracker.ingestion.store;

import com.navtracker.common.CalendarDays;
import com.navtracker.domain.PositionHistory;
import com.navtracker.domain.PositionHistoryRepository;
import com.navtracker.domain.PositionRecord;
import com.navtracker.domain.TokenHolding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records one position_history point per position and day, then flags positions of the wallet that vanished
 * from the refresh as inactive from today on. Inactive rows stay for history but are excluded from APY windows.
 * Records of one refresh that share a position id are summed into one point, since they share the storage key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionHistoryStore {

    private final PositionHistoryRepository positionHistoryRepository;
    private final Clock clock;

    /**
     * @return number of rows newly flagged inactive
     * @throws SnapshotPersistenceException when a write fails
     */
    public long record(String userId, String walletAddress, List<PositionRecord> positions) {
        Instant now = clock.instant();
        String day = CalendarDays.dayKey(now, clock.getZone());
        Map<String, PositionHistory> entries = new LinkedHashMap<>();
        for (PositionRecord position : positions) {
            PositionHistory entry = toEntry(userId, walletAddress, day, now, position);
            entries.merge(position.getPositionId(), entry, PositionHistoryStore::combine);
        }
        if (entries.size() < positions.size()) {
            log.debug("Wallet {} of user {}: {} position(s) shared an id with another and were combined",
                    walletAddress, userId, positions.size() - entries.size());
        }
        Collection<String> activeIds = entries.keySet();
        try {
            for (PositionHistory entry : entries.values()) {
                positionHistoryRepository.upsertDaily(entry);
            }
            long deactivated = positionHistoryRepository.markInactiveExcept(userId, walletAddress, activeIds, day, now);
            log.debug("Position history for user {} wallet {}: {} active, {} marked inactive",
                    userId, walletAddress, activeIds.size(), deactivated);
            return deactivated;
        } catch (RuntimeException e) {
            throw new SnapshotPersistenceException(userId, walletAddress, e);
        }
    }

    private static PositionHistory combine(PositionHistory first, PositionHistory second) {
        first.setTotalValue(first.getTotalValue().add(second.getTotalValue()));
        first.setUnclaimedRewardsValue(first.getUnclaimedRewardsValue().add(second.getUnclaimedRewardsValue()));
        List<TokenHolding> tokens = new ArrayList<>(first.getTokens());
        tokens.addAll(second.getTokens());
        first.setTokens(tokens);
        List<TokenHolding> rewards = new ArrayList<>(first.getRewards());
        rewards.addAll(second.getRewards());
        first.setRewards(rewards);
        return first;
    }

    private static PositionHistory toEntry(String userId, String walletAddress, String day, Instant now,
                                           PositionRecord position) {
        PositionHistory entry = new PositionHistory();
        entry.setUserId(userId);
        entry.setWalletAddress(walletAddress);
        entry.setProtocolName(position.getProtocolName());
        entry.setPositionName(position.getPositionName());
        entry.setDebankPositionId(position.getPositionId());
        entry.setDay(day);
        entry.setDate(now);
        entry.setTotalValue(position.getTotalUsdValue());
        entry.setUnclaimedRewardsValue(position.getUnclaimedRewardsUsd());
        entry.setTokens(position.getSupplyTokens());
        entry.setRewards(position.getRewardTokens());
        entry.setActive(true);
        entry.setCreatedAt(now);
        entry.setUpdatedAt(now);
        return entry;
    }
}
