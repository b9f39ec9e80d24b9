package com.navtracker.domain;

import com.navtracker.common.UsdAmounts;

import java.math.BigDecimal;

/**
 * Portfolio value split used as NAV input. unclaimedRewardsValue is already contained in positionsValue.
 */
public record PortfolioTotals(BigDecimal tokensValue, BigDecimal positionsValue, BigDecimal unclaimedRewardsValue) {

    public static final PortfolioTotals ZERO = new PortfolioTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public PortfolioTotals {
        tokensValue = UsdAmounts.sanitize(tokensValue);
        positionsValue = UsdAmounts.sanitize(positionsValue);
        unclaimedRewardsValue = UsdAmounts.sanitize(unclaimedRewardsValue);
    }

    public static PortfolioTotals of(DailySnapshot snapshot) {
        return new PortfolioTotals(snapshot.getTokensNavUsd(), snapshot.getPositionsNavUsd(), snapshot.getUnclaimedRewardsUsd());
    }

    public PortfolioTotals plus(PortfolioTotals other) {
        return new PortfolioTotals(tokensValue.add(other.tokensValue),
                positionsValue.add(other.positionsValue),
                unclaimedRewardsValue.add(other.unclaimedRewardsValue));
    }

    public BigDecimal totalValue() {
        return tokensValue.add(positionsValue);
    }
}
