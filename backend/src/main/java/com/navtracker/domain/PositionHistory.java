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
import java.util.List;

/**
 * Daily point for one position, keyed by (userId, walletAddress, protocolName, debankPositionId, day).
 * Rows are never deleted; a position missing from a refresh is flagged active=false instead.
 */
@Document(collection = "position_history")
@CompoundIndex(name = "user_wallet_protocol_position_day",
        def = "{'userId': 1, 'walletAddress': 1, 'protocolName': 1, 'debankPositionId': 1, 'day': 1}", unique = true)
@CompoundIndex(name = "user_position_date", def = "{'userId': 1, 'debankPositionId': 1, 'date': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PositionHistory {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String walletAddress;
    private String protocolName;
    private String positionName;
    private String debankPositionId;
    private String day;
    private Instant date;
    private BigDecimal totalValue = BigDecimal.ZERO;
    private BigDecimal unclaimedRewardsValue = BigDecimal.ZERO;
    private List<TokenHolding> tokens = new ArrayList<>();
    private List<TokenHolding> rewards = new ArrayList<>();
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;

    public PositionHistory setTotalValue(BigDecimal totalValue) {
        this.totalValue = UsdAmounts.sanitize(totalValue);
        return this;
    }

    public PositionHistory setUnclaimedRewardsValue(BigDecimal unclaimedRewardsValue) {
        this.unclaimedRewardsValue = UsdAmounts.sanitize(unclaimedRewardsValue);
        return this;
    }

    public List<TokenHolding> getTokens() {
        return tokens == null ? List.of() : Collections.unmodifiableList(tokens);
    }

    public PositionHistory setTokens(List<TokenHolding> tokens) {
        this.tokens = tokens == null ? new ArrayList<>() : new ArrayList<>(tokens);
        return this;
    }

    public List<TokenHolding> getRewards() {
        return rewards == null ? List.of() : Collections.unmodifiableList(rewards);
    }

    public PositionHistory setRewards(List<TokenHolding> rewards) {
        this.rewards = rewards == null ? new ArrayList<>() : new ArrayList<>(rewards);
        return this;
    }
}
