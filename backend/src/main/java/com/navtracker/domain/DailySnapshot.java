package com.navtracker.domain;

import com.navtracker.common.UsdAmounts;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row per (userId, walletAddress, day). day is the ISO calendar date of the refresh in the reference zone;
 * same-day refreshes overwrite the row in place. USD totals are clamped to zero or above.
 */
@Document(collection = "daily_snapshots")
@CompoundIndex(name = "user_wallet_day", def = "{'userId': 1, 'walletAddress': 1, 'day': 1}", unique = true)
@CompoundIndex(name = "user_date", def = "{'userId': 1, 'date': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DailySnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String walletAddress;
    private String day;
    private Instant date;
    private BigDecimal totalNavUsd = BigDecimal.ZERO;
    private BigDecimal tokensNavUsd = BigDecimal.ZERO;
    private BigDecimal positionsNavUsd = BigDecimal.ZERO;
    private BigDecimal unclaimedRewardsUsd = BigDecimal.ZERO;
    private List<TokenHolding> tokens = new ArrayList<>();
    private List<PositionRecord> positions = new ArrayList<>();
    private Map<String, BigDecimal> chainDistribution = new LinkedHashMap<>();
    private Map<String, BigDecimal> protocolDistribution = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant updatedAt;

    public DailySnapshot setTotalNavUsd(BigDecimal totalNavUsd) {
        this.totalNavUsd = UsdAmounts.sanitize(totalNavUsd);
        return this;
    }

    public DailySnapshot setTokensNavUsd(BigDecimal tokensNavUsd) {
        this.tokensNavUsd = UsdAmounts.sanitize(tokensNavUsd);
        return this;
    }

    public DailySnapshot setPositionsNavUsd(BigDecimal positionsNavUsd) {
        this.positionsNavUsd = UsdAmounts.sanitize(positionsNavUsd);
        return this;
    }

    public DailySnapshot setUnclaimedRewardsUsd(BigDecimal unclaimedRewardsUsd) {
        this.unclaimedRewardsUsd = UsdAmounts.sanitize(unclaimedRewardsUsd);
        return this;
    }

    public List<TokenHolding> getTokens() {
        return tokens == null ? List.of() : Collections.unmodifiableList(tokens);
    }

    public DailySnapshot setTokens(List<TokenHolding> tokens) {
        this.tokens = tokens == null ? new ArrayList<>() : new ArrayList<>(tokens);
        return this;
    }

    public List<PositionRecord> getPositions() {
        return positions == null ? List.of() : Collections.unmodifiableList(positions);
    }

    public DailySnapshot setPositions(List<PositionRecord> positions) {
        this.positions = positions == null ? new ArrayList<>() : new ArrayList<>(positions);
        return this;
    }

    public Map<String, BigDecimal> getChainDistribution() {
        return chainDistribution == null ? Map.of() : Collections.unmodifiableMap(chainDistribution);
    }

    public DailySnapshot setChainDistribution(Map<String, BigDecimal> chainDistribution) {
        this.chainDistribution = chainDistribution == null ? new LinkedHashMap<>() : new LinkedHashMap<>(chainDistribution);
        return this;
    }

    public Map<String, BigDecimal> getProtocolDistribution() {
        return protocolDistribution == null ? Map.of() : Collections.unmodifiableMap(protocolDistribution);
    }

    public DailySnapshot setProtocolDistribution(Map<String, BigDecimal> protocolDistribution) {
        this.protocolDistribution = protocolDistribution == null ? new LinkedHashMap<>() : new LinkedHashMap<>(protocolDistribution);
        return this;
    }
}
