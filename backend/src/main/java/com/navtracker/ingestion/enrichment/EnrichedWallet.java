package com.navtracker.ingestion.enrichment;

import com.navtracker.domain.PositionRecord;
import com.navtracker.domain.TokenHolding;
import com.navtracker.ingestion.position.DedupedProtocol;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Priced, deduplicated view of one wallet, ready to be persisted as a daily snapshot.
 * totalValue = tokensValue + positionsValue.
 */
public record EnrichedWallet(
        String walletAddress,
        List<TokenHolding> tokens,
        List<DedupedProtocol> protocols,
        List<PositionRecord> positions,
        BigDecimal tokensValue,
        BigDecimal positionsValue,
        BigDecimal unclaimedRewardsValue,
        Map<String, BigDecimal> chainDistribution,
        Map<String, BigDecimal> protocolDistribution
) {

    public EnrichedWallet {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        protocols = protocols == null ? List.of() : List.copyOf(protocols);
        positions = positions == null ? List.of() : List.copyOf(positions);
        chainDistribution = chainDistribution == null ? Map.of() : Map.copyOf(chainDistribution);
        protocolDistribution = protocolDistribution == null ? Map.of() : Map.copyOf(protocolDistribution);
    }

    public BigDecimal totalValue() {
        return tokensValue.add(positionsValue);
    }
}
