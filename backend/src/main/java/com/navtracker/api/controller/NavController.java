package com.navtracker.api.controller;

import com.navtracker.api.dto.NavCalculateRequest;
import com.navtracker.api.dto.NavSaveRequest;
import com.navtracker.api.dto.ResetResponse;
import com.navtracker.domain.NavSettings;
import com.navtracker.nav.NavHistoryEntry;
import com.navtracker.nav.NavMonth;
import com.navtracker.nav.NavSettingsService;
import com.navtracker.nav.PriorNavLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Monthly NAV settings: read (created lazily), save, calculate, prior-month lookup, history and reset.
 */
@RestController
@RequestMapping("/api/v1/nav")
@RequiredArgsConstructor
public class NavController {

    private final NavSettingsService navSettingsService;

    @GetMapping("/{userId}/{year}/{month}")
    public ResponseEntity<NavSettings> get(@PathVariable String userId, @PathVariable int year, @PathVariable int month) {
        return ResponseEntity.ok(navSettingsService.getNav(userId, year, month));
    }

    @PostMapping("/{userId}/{year}/{month}")
    public ResponseEntity<NavSettings> save(@PathVariable String userId, @PathVariable int year, @PathVariable int month,
                                            @RequestBody NavSaveRequest request) {
        return ResponseEntity.ok(navSettingsService.saveNav(userId, year, month,
                request.feeSettings(), request.navCalculations()));
    }

    @PostMapping("/{userId}/{year}/{month}/calculate")
    public ResponseEntity<?> calculate(@PathVariable String userId, @PathVariable int year, @PathVariable int month,
                                       @RequestBody(required = false) NavCalculateRequest request) {
        if (request != null && request.save()) {
            return ResponseEntity.ok(navSettingsService.calculateAndSave(userId, year, month, request.feeSettings()));
        }
        return ResponseEntity.ok(navSettingsService.calculateNav(userId, year, month,
                request != null ? request.feeSettings() : null));
    }

    @GetMapping("/{userId}/{year}/{month}/prior")
    public ResponseEntity<PriorNavLookup> prior(@PathVariable String userId, @PathVariable int year, @PathVariable int month) {
        return ResponseEntity.ok(navSettingsService.getPriorNav(userId, year, month));
    }

    @PostMapping("/{userId}/{year}/{month}/portfolio-estimate")
    public ResponseEntity<NavSettings> portfolioEstimate(@PathVariable String userId, @PathVariable int year,
                                                         @PathVariable int month) {
        return ResponseEntity.ok(navSettingsService.usePortfolioEstimate(userId, year, month));
    }

    @GetMapping("/{userId}/months")
    public ResponseEntity<List<NavMonth>> months(@PathVariable String userId) {
        return ResponseEntity.ok(navSettingsService.availableMonths(userId));
    }

    @GetMapping("/{userId}/history")
    public ResponseEntity<List<NavHistoryEntry>> history(@PathVariable String userId,
                                                         @RequestParam(required = false, defaultValue = "0") int limit) {
        return ResponseEntity.ok(navSettingsService.history(userId, limit));
    }

    @DeleteMapping("/{userId}/{year}/{month}")
    public ResponseEntity<Void> deleteMonth(@PathVariable String userId, @PathVariable int year, @PathVariable int month) {
        navSettingsService.deleteNav(userId, year, month);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<ResetResponse> reset(@PathVariable String userId) {
        return ResponseEntity.ok(new ResetResponse(userId, navSettingsService.reset(userId)));
    }
}
