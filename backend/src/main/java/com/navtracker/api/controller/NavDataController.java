package com.navtracker.api.controller;

import com.navtracker.api.dto.MonthlyNavRequest;
import com.navtracker.api.dto.NavValuesRequest;
import com.navtracker.api.dto.NetFlowsRequest;
import com.navtracker.api.dto.ResetResponse;
import com.navtracker.api.dto.WalletNetFlowsRequest;
import com.navtracker.nav.NavDataService;
import com.navtracker.nav.NavDataView;
import com.navtracker.nav.NetFlowsUpdate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-user NAV data: net flows, latest NAV values and the monthly NAV series with its volatility.
 */
@RestController
@RequestMapping("/api/v1/nav-data/{userId}")
@RequiredArgsConstructor
public class NavDataController {

    private final NavDataService navDataService;

    @GetMapping
    public ResponseEntity<NavDataView> get(@PathVariable String userId) {
        return ResponseEntity.ok(navDataService.get(userId));
    }

    @PostMapping("/netflows")
    public ResponseEntity<NetFlowsUpdate> netFlows(@PathVariable String userId,
                                                   @RequestBody @Valid NetFlowsRequest request) {
        return ResponseEntity.ok(navDataService.updateNetFlows(userId, request.netFlows()));
    }

    @PostMapping("/wallet-netflows")
    public ResponseEntity<NetFlowsUpdate> walletNetFlows(@PathVariable String userId,
                                                         @RequestBody @Valid WalletNetFlowsRequest request) {
        return ResponseEntity.ok(navDataService.updateWalletNetFlows(userId, request.walletAddress(), request.netFlows()));
    }

    @PostMapping("/values")
    public ResponseEntity<NavDataView> values(@PathVariable String userId, @RequestBody NavValuesRequest request) {
        return ResponseEntity.ok(navDataService.updateNavValues(userId, request.priorPreFeeNav(),
                request.currentPreFeeNav(), request.performance()));
    }

    @PostMapping("/monthly")
    public ResponseEntity<NavDataView> monthly(@PathVariable String userId,
                                               @RequestBody @Valid MonthlyNavRequest request) {
        return ResponseEntity.ok(navDataService.addMonthlyNav(userId, request.date(), request.nav()));
    }

    @GetMapping("/volatility")
    public ResponseEntity<NavDataView> volatility(@PathVariable String userId) {
        return ResponseEntity.ok(navDataService.volatility(userId));
    }

    @DeleteMapping
    public ResponseEntity<ResetResponse> reset(@PathVariable String userId) {
        return ResponseEntity.ok(new ResetResponse(userId, navDataService.reset(userId) ? 1 : 0));
    }
}
