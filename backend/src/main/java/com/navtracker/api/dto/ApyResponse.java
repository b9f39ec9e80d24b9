package com.navtracker.api.dto;

import com.navtracker.apy.ApyResult;

import java.time.LocalDate;
import java.util.Map;

/**
 * GET /api/v1/positions/{userId}/apy response. positions is keyed by position id.
 */
public record ApyResponse(
        String userId,
        LocalDate targetDate,
        int periodDays,
        int positionCount,
        Map<String, ApyResult> positions
) {
}
