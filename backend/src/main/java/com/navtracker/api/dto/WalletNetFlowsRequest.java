package com.navtracker.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * POST /api/v1/nav-data/{userId}/wallet-netflows request body.
 */
public record WalletNetFlowsRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String walletAddress,

        @NotNull(message = "INVALID_REQUEST")
        BigDecimal netFlows
) {
}
