package com.navtracker.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * POST /api/v1/portfolio/refresh request body.
 */
public record RefreshRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String userId,

        @NotEmpty(message = "INVALID_REQUEST")
        List<String> wallets
) {
}
