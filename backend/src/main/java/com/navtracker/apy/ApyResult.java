package com.navtracker.apy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * APY of one position. apy and periodReturn are percentages; days is the elapsed time the return was measured over.
 * apy is always a finite number.
 */
public record ApyResult(
        String positionId,
        String protocolName,
        String positionName,
        String walletAddress,
        BigDecimal apy,
        BigDecimal periodReturn,
        BigDecimal days,
        @JsonProperty("isNewPosition") boolean newPosition,
        ApyConfidence confidence,
        ApyCalculationMethod calculationMethod,
        BigDecimal currentValue,
        BigDecimal unclaimedRewards,
        List<String> warnings
) {

    public ApyResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
