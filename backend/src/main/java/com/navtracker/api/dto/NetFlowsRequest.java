package com.navtracker.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * POST /api/v1/nav-data/{userId}/netflows request body. Signed: withdrawals are negative.
 */
public record NetFlowsRequest(
        @NotNull(message = "INVALID_REQUEST")
        BigDecimal netFlows
) {
}
