package com.navtracker.api.dto;

import com.navtracker.domain.FeeSettings;
import com.navtracker.domain.NavCalculations;

/**
 * POST /api/v1/nav/{userId}/{year}/{month} request body. Validation warnings in navCalculations are ignored and
 * recomputed.
 */
public record NavSaveRequest(
        FeeSettings feeSettings,
        NavCalculations navCalculations
) {
}
