package com.navtracker.ingestion.position;

import com.navtracker.ingestion.adapter.debank.RawPosition;
import com.navtracker.ingestion.adapter.debank.RawProtocol;
import com.navtracker.ingestion.adapter.debank.RawToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProtocolDeduplicatorTest {

    private final ProtocolDeduplicator deduplicator = new ProtocolDeduplicator();

    @Test
    @DisplayName("repeated protocol name keeps the larger net value and unions positions")
    void mergesByName() {
        RawProtocol first = protocol("Uniswap V3", 100.0, position("0xa", token("ETH", 1.0, 2000.0)));
        RawProtocol second = protocol("Uniswap V3", 250.0, position("0xb", token("USDC", 50.0, 1.0)));

        List<DedupedProtocol> result = deduplicator.dedupe(List.of(first, second));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).netUsdValue()).isEqualByComparingTo("250");
        assertThat(result.get(0).positions()).hasSize(2);
        assertThat(result.get(0).valueRecomputed()).isFalse();
    }

    @Test
    @DisplayName("k exact duplicates plus m distinct positions collapse to m+1")
    void dropsDuplicateSignatures() {
        RawPosition dup = position("0xa", token("ETH", 1.0, 2000.0));
        List<RawPosition> positions = new ArrayList<>(Arrays.asList(dup, dup, dup));
        positions.add(position("0xb", token("ETH", 1.0, 2000.0)));
        positions.add(position("0xa", token("ETH", 2.0, 2000.0)));
        RawProtocol protocol = new RawProtocol("p", "eth", "Proto", 10.0, null, null, null, null, positions);

        List<DedupedProtocol> result = deduplicator.dedupe(List.of(protocol));

        assertThat(result.get(0).positions()).hasSize(3);
    }

    @Test
    @DisplayName("order of first appearance is preserved and blank names group under unknown")
    void preservesOrderAndUnknown() {
        List<DedupedProtocol> result = deduplicator.dedupe(List.of(
                protocol("Curve", 5.0),
                protocol(null, 1.0),
                protocol("Aave", 3.0),
                protocol(" ", 2.0)));

        assertThat(result).extracting(DedupedProtocol::name).containsExactly("Curve", "unknown", "Aave");
        assertThat(result.get(1).netUsdValue()).isEqualByComparingTo("2");
    }

    @Test
    @DisplayName("value below one cent is recomputed from supply and reward tokens")
    void recomputesTinyValue() {
        RawPosition position = new RawPosition("LP", new RawPosition.Pool("0xa", "LP"),
                new RawPosition.Detail(List.of(token("ETH", 0.5, 2000.0)), List.of(token("ARB", 10.0, 1.5)),
                        List.of(), null, null), null, null);
        RawProtocol protocol = new RawProtocol("p", "arb", "Camelot", 0.0, null, null, null, null, List.of(position));

        DedupedProtocol result = deduplicator.dedupe(List.of(protocol)).get(0);

        assertThat(result.valueRecomputed()).isTrue();
        assertThat(result.netUsdValue()).isEqualByComparingTo("1015");
    }

    @Test
    @DisplayName("null or empty input yields an empty list")
    void emptyInput() {
        assertThat(deduplicator.dedupe(null)).isEmpty();
        assertThat(deduplicator.dedupe(List.of())).isEmpty();
    }

    private static RawProtocol protocol(String name, Double value, RawPosition... positions) {
        return new RawProtocol("id-" + name, "eth", name, value, null, null, null, null, List.of(positions));
    }

    private static RawPosition position(String poolId, RawToken... supply) {
        return new RawPosition("LP", new RawPosition.Pool(poolId, "LP"),
                new RawPosition.Detail(List.of(supply), List.of(), List.of(), null, null), null, null);
    }

    private static RawToken token(String symbol, double amount, double price) {
        return new RawToken(symbol, "eth", symbol, symbol, amount, price, 18, null, true);
    }
}
