package com.navtracker.api.controller;

import com.navtracker.api.dto.ApyResponse;
import com.navtracker.apy.ApyEngine;
import com.navtracker.apy.ApyProperties;
import com.navtracker.apy.ApyResult;
import com.navtracker.apy.PositionPerformanceService;
import com.navtracker.apy.PositionPerformanceSummary;
import com.navtracker.domain.PositionHistory;
import com.navtracker.snapshot.SnapshotQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Per-position APY, the largest positions' performance and position history.
 */
@RestController
@RequestMapping("/api/v1/positions")
@RequiredArgsConstructor
public class PositionController {

    private final ApyEngine apyEngine;
    private final ApyProperties apyProperties;
    private final SnapshotQueryService snapshotQueryService;
    private final PositionPerformanceService positionPerformanceService;

    @GetMapping("/{userId}/apy")
    public ResponseEntity<ApyResponse> apy(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate,
            @RequestParam(required = false) Integer period
    ) {
        LocalDate target = targetDate != null ? targetDate : snapshotQueryService.today();
        int periodDays = period != null ? period : apyProperties.getDefaultPeriodDays();
        Map<String, ApyResult> results = apyEngine.calculateAllPositionAPYs(userId, target, periodDays);
        return ResponseEntity.ok(new ApyResponse(userId, target, periodDays, results.size(), results));
    }

    @GetMapping("/{userId}/performance-summary")
    public ResponseEntity<PositionPerformanceSummary> performanceSummary(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate,
            @RequestParam(required = false) Integer period,
            @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        LocalDate target = targetDate != null ? targetDate : snapshotQueryService.today();
        int periodDays = period != null ? period : apyProperties.getDefaultPeriodDays();
        return ResponseEntity.ok(positionPerformanceService.summary(userId, target, periodDays, limit));
    }

    @GetMapping("/{userId}/history/{positionId}")
    public ResponseEntity<List<PositionHistory>> history(
            @PathVariable String userId,
            @PathVariable String positionId,
            @RequestParam(required = false, defaultValue = "30") int limit,
            @RequestParam(required = false, defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(snapshotQueryService.positionHistory(userId, positionId, limit, includeInactive));
    }
}
