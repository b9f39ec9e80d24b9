package com.navtracker.ingestion.adapter.debank;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Upstream wallet aggregator. Errors surface as {@link UpstreamFetchException}.
 */
public interface DebankClient {

    Mono<List<RawToken>> fetchTokens(String walletAddress);

    /**
     * Complex protocol list across all configured chains, concatenated in chain order.
     */
    Mono<List<RawProtocol>> fetchProtocols(String walletAddress);
}
