package com.navtracker.ingestion.position;

import com.navtracker.common.UsdAmounts;
import com.navtracker.ingestion.adapter.debank.RawPosition;
import com.navtracker.ingestion.adapter.debank.RawProtocol;
import com.navtracker.ingestion.adapter.debank.RawToken;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Collapses one fetch of upstream protocols into canonical entries. Pure: no I/O, no logging.
 * <ol>
 *   <li>Protocols are grouped by name (case-sensitive) in first-appearance order; repeated names union their
 *   positions and keep the larger net USD value.</li>
 *   <li>Positions of a protocol are keyed by {@link PositionIdentity#signature}; the first one seen wins.</li>
 *   <li>A net value that is missing or below $0.01 is recomputed as Σ amount × price over supply and reward tokens
 *   of the kept positions.</li>
 * </ol>
 */
@Component
public class ProtocolDeduplicator {

    public static final String UNKNOWN_PROTOCOL = "unknown";
    static final BigDecimal MIN_REPORTED_VALUE = new BigDecimal("0.01");

    public List<DedupedProtocol> dedupe(List<RawProtocol> rawProtocols) {
        if (rawProtocols == null || rawProtocols.isEmpty()) {
            return List.of();
        }
        Map<String, Group> byName = new LinkedHashMap<>();
        for (RawProtocol protocol : rawProtocols) {
            if (protocol == null) {
                continue;
            }
            String name = protocol.name() == null || protocol.name().isBlank() ? UNKNOWN_PROTOCOL : protocol.name();
            Group group = byName.get(name);
            if (group == null) {
                byName.put(name, new Group(name, protocol));
            } else {
                group.merge(protocol);
            }
        }
        return byName.values().stream().map(Group::toDeduped).toList();
    }

    static BigDecimal positionsValue(List<RawPosition> positions) {
        return positions.stream()
                .flatMap(p -> Stream.concat(p.supplyTokens().stream(), p.rewardTokens().stream()))
                .filter(t -> t != null)
                .map(ProtocolDeduplicator::tokenValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal tokenValue(RawToken token) {
        return UsdAmounts.value(UsdAmounts.sanitize(token.amount()), UsdAmounts.sanitize(token.price()));
    }

    private static final class Group {

        private final String name;
        private final RawProtocol first;
        private final List<RawPosition> positions = new ArrayList<>();
        private Double netUsdValue;

        Group(String name, RawProtocol first) {
            this.name = name;
            this.first = first;
            this.netUsdValue = first.netUsdValue();
            positions.addAll(first.positions());
        }

        void merge(RawProtocol duplicate) {
            positions.addAll(duplicate.positions());
            Double other = duplicate.netUsdValue();
            if (other != null && !other.isNaN() && (netUsdValue == null || netUsdValue.isNaN() || other > netUsdValue)) {
                netUsdValue = other;
            }
        }

        DedupedProtocol toDeduped() {
            Map<String, RawPosition> unique = new LinkedHashMap<>();
            for (RawPosition position : positions) {
                if (position != null) {
                    unique.putIfAbsent(PositionIdentity.signature(position), position);
                }
            }
            List<RawPosition> kept = List.copyOf(unique.values());
            BigDecimal value = UsdAmounts.sanitize(netUsdValue);
            boolean recomputed = value.compareTo(MIN_REPORTED_VALUE) < 0;
            if (recomputed) {
                value = positionsValue(kept);
            }
            return new DedupedProtocol(first.id(), first.chain(), name, first.logoUrl(), first.siteUrl(),
                    value, recomputed, kept);
        }
    }
}
