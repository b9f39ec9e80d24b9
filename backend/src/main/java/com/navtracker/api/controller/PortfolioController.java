package com.navtracker.api.controller;

import com.navtracker.api.dto.ErrorBody;
import com.navtracker.api.dto.PortfolioAtDateResponse;
import com.navtracker.api.dto.RefreshRequest;
import com.navtracker.api.dto.RefreshResponse;
import com.navtracker.api.dto.SnapshotPointResponse;
import com.navtracker.api.dto.WalletRefreshSummary;
import com.navtracker.apy.TokenApy;
import com.navtracker.apy.TokenApyEngine;
import com.navtracker.domain.DailySnapshot;
import com.navtracker.ingestion.refresh.RefreshReport;
import com.navtracker.ingestion.refresh.WalletRefreshResult;
import com.navtracker.ingestion.refresh.WalletRefreshService;
import com.navtracker.snapshot.PortfolioAtDate;
import com.navtracker.snapshot.PortfolioPerformance;
import com.navtracker.snapshot.ReportType;
import com.navtracker.snapshot.SnapshotQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Wallet refresh and snapshot queries: history, portfolio at a date, PnL since the last report, performance and
 * token price APYs.
 */
@RestController
@RequestMapping("/api/v1/portfolio")
@RequiredArgsConstructor
public class PortfolioController {

    static final int DEFAULT_HISTORY_DAYS = 30;

    private final WalletRefreshService walletRefreshService;
    private final SnapshotQueryService snapshotQueryService;
    private final TokenApyEngine tokenApyEngine;

    /**
     * Fetches, enriches and stores today's snapshot of each wallet. Runs off the event loop because the pipeline blocks.
     */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<RefreshResponse>> refresh(@RequestBody @Valid RefreshRequest request) {
        return Mono.fromCallable(() -> walletRefreshService.refresh(request.userId().trim(), request.wallets()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(report -> ResponseEntity.ok(toResponse(report)));
    }

    @GetMapping("/{userId}/history")
    public ResponseEntity<?> history(
            @PathVariable String userId,
            @RequestParam(required = false) String wallet,
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        List<DailySnapshot> snapshots;
        if (from != null || to != null) {
            if (from == null || to == null) {
                return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "from and to must be given together"));
            }
            snapshots = snapshotQueryService.getHistory(userId, wallet, from, to);
        } else {
            snapshots = snapshotQueryService.getHistory(userId, wallet, days != null ? days : DEFAULT_HISTORY_DAYS);
        }
        return ResponseEntity.ok(snapshots.stream().map(PortfolioController::toPoint).toList());
    }

    @GetMapping("/{userId}/at")
    public ResponseEntity<PortfolioAtDateResponse> atDate(
            @PathVariable String userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String wallet
    ) {
        PortfolioAtDate portfolio = snapshotQueryService.portfolioAtDate(userId, date, wallet);
        return ResponseEntity.ok(new PortfolioAtDateResponse(
                portfolio.date(),
                portfolio.totalNav(),
                portfolio.totals().tokensValue(),
                portfolio.totals().positionsValue(),
                portfolio.totals().unclaimedRewardsValue(),
                portfolio.tokenCount(),
                portfolio.positionCount(),
                portfolio.snapshotDays(),
                portfolio.exactMatch()));
    }

    @GetMapping("/{userId}/pnl")
    public ResponseEntity<?> pnl(@PathVariable String userId,
                                 @RequestParam(required = false, defaultValue = "daily") String reportType) {
        ReportType type;
        try {
            type = ReportType.valueOf(reportType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST",
                    "reportType must be one of daily, weekly, monthly"));
        }
        return ResponseEntity.ok(snapshotQueryService.pnlSinceLastReport(userId, type));
    }

    @GetMapping("/{userId}/performance")
    public ResponseEntity<PortfolioPerformance> performance(
            @PathVariable String userId,
            @RequestParam(required = false, defaultValue = "30") int period,
            @RequestParam(required = false) String wallet
    ) {
        return ResponseEntity.ok(snapshotQueryService.performance(userId, period, wallet));
    }

    @GetMapping("/{userId}/token-apy")
    public ResponseEntity<Map<String, TokenApy>> tokenApy(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate
    ) {
        LocalDate target = targetDate != null ? targetDate : snapshotQueryService.today();
        return ResponseEntity.ok(tokenApyEngine.calculateAllTokenAPYs(userId, target));
    }

    private static RefreshResponse toResponse(RefreshReport report) {
        return new RefreshResponse(report.userId(), report.totalNavUsd(), report.degradedCount(),
                report.wallets().stream().map(PortfolioController::toSummary).toList());
    }

    private static WalletRefreshSummary toSummary(WalletRefreshResult result) {
        DailySnapshot s = result.snapshot();
        if (s == null) {
            return new WalletRefreshSummary(result.walletAddress(), null, null, null, null, null, 0, 0,
                    result.degraded(), result.degradedReason(), result.positionsDeactivated());
        }
        return new WalletRefreshSummary(result.walletAddress(), s.getDay(), s.getTotalNavUsd(), s.getTokensNavUsd(),
                s.getPositionsNavUsd(), s.getUnclaimedRewardsUsd(), s.getTokens().size(), s.getPositions().size(),
                result.degraded(), result.degradedReason(), result.positionsDeactivated());
    }

    private static SnapshotPointResponse toPoint(DailySnapshot s) {
        return new SnapshotPointResponse(s.getWalletAddress(), s.getDay(), s.getDate(), s.getTotalNavUsd(),
                s.getTokensNavUsd(), s.getPositionsNavUsd(), s.getUnclaimedRewardsUsd(),
                s.getChainDistribution(), s.getProtocolDistribution());
    }
}
