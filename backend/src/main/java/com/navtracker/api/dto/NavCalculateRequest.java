package com.navtracker.api.dto;

import com.navtracker.domain.FeeSettings;

/**
 * POST /api/v1/nav/{userId}/{year}/{month}/calculate request body. A null feeSettings uses the stored settings;
 * save=false only previews.
 */
public record NavCalculateRequest(
        FeeSettings feeSettings,
        boolean save
) {
}
