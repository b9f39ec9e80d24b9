package com.navtracker.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public record PortfolioAtDateResponse(
        LocalDate date,
        BigDecimal totalNav,
        BigDecimal tokensValue,
        BigDecimal positionsValue,
        BigDecimal unclaimedRewardsValue,
        int tokenCount,
        int positionCount,
        Map<String, String> snapshotDays,
        boolean exactMatch
) {
}
