package com.navtracker.ingestion.refresh;

import com.navtracker.config.AsyncConfig;
import com.navtracker.domain.DailySnapshot;
import com.navtracker.ingestion.adapter.debank.DebankClient;
import com.navtracker.ingestion.adapter.debank.RawProtocol;
import com.navtracker.ingestion.adapter.debank.RawToken;
import com.navtracker.ingestion.adapter.debank.UpstreamFetchException;
import com.navtracker.ingestion.enrichment.EnrichedWallet;
import com.navtracker.ingestion.enrichment.WalletEnricher;
import com.navtracker.ingestion.store.PositionHistoryStore;
import com.navtracker.ingestion.store.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Request-driven wallet refresh. Wallets of one request run concurrently on the refresh executor; for each wallet
 * tokens and protocols are fetched concurrently, enriched, then persisted as today's snapshot and position history.
 * <p>
 * Upstream failure degrades only that wallet to its last stored snapshot. Persistence failure fails the request.
 */
@Service
@Slf4j
public class WalletRefreshService {

    private final DebankClient debankClient;
    private final WalletEnricher walletEnricher;
    private final SnapshotStore snapshotStore;
    private final PositionHistoryStore positionHistoryStore;
    private final Executor refreshExecutor;

    public WalletRefreshService(DebankClient debankClient,
                                WalletEnricher walletEnricher,
                                SnapshotStore snapshotStore,
                                PositionHistoryStore positionHistoryStore,
                                @Qualifier(AsyncConfig.REFRESH_EXECUTOR) Executor refreshExecutor) {
        this.debankClient = debankClient;
        this.walletEnricher = walletEnricher;
        this.snapshotStore = snapshotStore;
        this.positionHistoryStore = positionHistoryStore;
        this.refreshExecutor = refreshExecutor;
    }

    /**
     * Refreshes every wallet of the user and waits for all of them.
     *
     * @throws com.navtracker.ingestion.store.SnapshotPersistenceException if any wallet fails to persist
     */
    public RefreshReport refresh(String userId, List<String> wallets) {
        List<String> normalized = wallets == null ? List.of() : wallets.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        List<CompletableFuture<WalletRefreshResult>> futures = normalized.stream()
                .map(wallet -> CompletableFuture.supplyAsync(() -> refreshWallet(userId, wallet), refreshExecutor))
                .toList();

        List<WalletRefreshResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<WalletRefreshResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
        RefreshReport report = new RefreshReport(userId, results);
        log.info("Refresh for user {}: {} wallets, {} degraded, total ${}",
                userId, results.size(), report.degradedCount(), report.totalNavUsd());
        return report;
    }

    /**
     * Fetch, enrich and persist one wallet.
     */
    public WalletRefreshResult refreshWallet(String userId, String walletAddress) {
        EnrichedWallet enriched;
        try {
            Tuple2<List<RawToken>, List<RawProtocol>> fetched =
                    Mono.zip(debankClient.fetchTokens(walletAddress), debankClient.fetchProtocols(walletAddress))
                            .onErrorMap(e -> !(e instanceof UpstreamFetchException),
                                    e -> new UpstreamFetchException("Upstream fetch failed for " + walletAddress, e))
                            .block();
            if (fetched == null) {
                throw new UpstreamFetchException("Empty upstream response for " + walletAddress);
            }
            enriched = walletEnricher.enrich(walletAddress, fetched.getT1(), fetched.getT2());
        } catch (UpstreamFetchException e) {
            return fallback(userId, walletAddress, e);
        }

        DailySnapshot snapshot = snapshotStore.upsertSnapshot(userId, walletAddress, enriched);
        long deactivated = positionHistoryStore.record(userId, walletAddress, enriched.positions());
        return WalletRefreshResult.live(walletAddress, snapshot, deactivated);
    }

    private WalletRefreshResult fallback(String userId, String walletAddress, UpstreamFetchException e) {
        DailySnapshot lastKnownGood = snapshotStore.latestSnapshot(userId, walletAddress).orElse(null);
        if (lastKnownGood != null) {
            log.warn("Upstream failed for wallet {} (user {}), using stored snapshot of {}: {}",
                    walletAddress, userId, lastKnownGood.getDay(), e.getMessage());
        } else {
            log.warn("Upstream failed for wallet {} (user {}) and no stored snapshot exists: {}",
                    walletAddress, userId, e.getMessage());
        }
        return WalletRefreshResult.degraded(walletAddress, lastKnownGood, e.getMessage());
    }
}
