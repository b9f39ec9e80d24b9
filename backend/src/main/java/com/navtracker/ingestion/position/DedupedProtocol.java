package com.navtracker.ingestion.position;

import com.navtracker.ingestion.adapter.debank.RawPosition;

import java.math.BigDecimal;
import java.util.List;

/**
 * Protocol after deduplication: one entry per name, unique positions, and a usable USD value.
 *
 * @param netUsdValue    upstream value, or the amount × price sum when upstream reported less than $0.01
 * @param valueRecomputed true when netUsdValue was recomputed from positions
 */
public record DedupedProtocol(
        String id,
        String chain,
        String name,
        String logoUrl,
        String siteUrl,
        BigDecimal netUsdValue,
        boolean valueRecomputed,
        List<RawPosition> positions
) {

    public DedupedProtocol {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
