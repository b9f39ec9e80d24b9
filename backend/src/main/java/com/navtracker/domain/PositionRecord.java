package com.navtracker.domain;

import com.navtracker.common.UsdAmounts;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One deduplicated protocol position inside a daily snapshot. positionId is the stable identity also used as
 * PositionHistory.debankPositionId.
 */
@NoArgsConstructor
@Getter
@Setter
@Accessors(chain = true)
public class PositionRecord {

    private String positionId;
    private String protocolId;
    private String protocolName;
    private String chain;
    private String positionName;
    private String poolId;
    private List<TokenHolding> supplyTokens = new ArrayList<>();
    private List<TokenHolding> rewardTokens = new ArrayList<>();
    private BigDecimal totalUsdValue = BigDecimal.ZERO;
    private BigDecimal unclaimedRewardsUsd = BigDecimal.ZERO;

    public List<TokenHolding> getSupplyTokens() {
        return supplyTokens == null ? List.of() : Collections.unmodifiableList(supplyTokens);
    }

    public PositionRecord setSupplyTokens(List<TokenHolding> supplyTokens) {
        this.supplyTokens = supplyTokens == null ? new ArrayList<>() : new ArrayList<>(supplyTokens);
        return this;
    }

    public List<TokenHolding> getRewardTokens() {
        return rewardTokens == null ? List.of() : Collections.unmodifiableList(rewardTokens);
    }

    public PositionRecord setRewardTokens(List<TokenHolding> rewardTokens) {
        this.rewardTokens = rewardTokens == null ? new ArrayList<>() : new ArrayList<>(rewardTokens);
        return this;
    }

    public PositionRecord setTotalUsdValue(BigDecimal totalUsdValue) {
        this.totalUsdValue = UsdAmounts.sanitize(totalUsdValue);
        return this;
    }

    public PositionRecord setUnclaimedRewardsUsd(BigDecimal unclaimedRewardsUsd) {
        this.unclaimedRewardsUsd = UsdAmounts.sanitize(unclaimedRewardsUsd);
        return this;
    }
}
