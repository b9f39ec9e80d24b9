package com.navtracker.api.dto;

import java.math.BigDecimal;

/**
 * POST /api/v1/nav-data/{userId}/values request body. Omitted values stay unchanged.
 */
public record NavValuesRequest(
        BigDecimal priorPreFeeNav,
        BigDecimal currentPreFeeNav,
        BigDecimal performance
) {
}
