package com.navtracker.ingestion.position;

import com.navtracker.ingestion.adapter.debank.RawPosition;
import com.navtracker.ingestion.adapter.debank.RawToken;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Identity rules for upstream positions.
 * <ul>
 *   <li>{@link #signature} collapses duplicates inside one fetch: same pool and same supplied amounts (6 dp).</li>
 *   <li>{@link #positionId} is stable across fetches and keys position history; it never contains amounts.</li>
 * </ul>
 */
public final class PositionIdentity {

    public static final String NO_POOL = "no-pool";
    private static final int SIGNATURE_SCALE = 6;

    private PositionIdentity() {
    }

    /**
     * poolId (or "no-pool") + "-" + supply tokens as SYMBOL:amount, sorted and joined with '|'.
     */
    public static String signature(RawPosition position) {
        String pool = isBlank(position.poolId()) ? NO_POOL : position.poolId();
        String tokenAmounts = position.supplyTokens().stream()
                .filter(Objects::nonNull)
                .map(t -> Objects.toString(t.symbol(), "") + ":" + fixed(t.amount()))
                .sorted()
                .collect(Collectors.joining("|"));
        return pool + "-" + tokenAmounts;
    }

    /**
     * Stable id persisted as debankPositionId: the upstream portfolio item id when present, else
     * chain:protocolId:poolId, else chain:protocolId:positionName:SORTED_SUPPLY_SYMBOLS. The fallbacks get
     * ":positionIndex" appended when the upstream index is set and differs from the pool id.
     */
    public static String positionId(DedupedProtocol protocol, RawPosition position) {
        if (!isBlank(position.portfolioItemId())) {
            return position.portfolioItemId();
        }
        String chain = lower(protocol.chain());
        String protocolKey = lower(isBlank(protocol.id()) ? protocol.name() : protocol.id());
        if (!isBlank(position.poolId())) {
            return withIndex(chain + ":" + protocolKey + ":" + position.poolId().toLowerCase(Locale.ROOT), position);
        }
        String symbols = position.supplyTokens().stream()
                .filter(Objects::nonNull)
                .map(RawToken::symbol)
                .map(PositionIdentity::lower)
                .distinct()
                .sorted()
                .collect(Collectors.joining(","));
        return withIndex(chain + ":" + protocolKey + ":" + lower(position.name()) + ":" + symbols, position);
    }

    private static String withIndex(String id, RawPosition position) {
        String index = position.positionIndex();
        if (isBlank(index) || index.strip().equalsIgnoreCase(Objects.toString(position.poolId(), ""))) {
            return id;
        }
        return id + ":" + lower(index);
    }

    static String fixed(Double amount) {
        if (amount == null || amount.isNaN() || amount.isInfinite()) {
            return BigDecimal.ZERO.setScale(SIGNATURE_SCALE).toPlainString();
        }
        return BigDecimal.valueOf(amount).setScale(SIGNATURE_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String lower(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
