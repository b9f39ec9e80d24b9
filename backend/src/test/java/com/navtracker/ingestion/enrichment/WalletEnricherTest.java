package com.navtracker.ingestion.enrichment;

import com.navtracker.domain.PositionRecord;
import com.navtracker.domain.TokenHolding;
import com.navtracker.ingestion.adapter.debank.RawPosition;
import com.navtracker.ingestion.adapter.debank.RawProtocol;
import com.navtracker.ingestion.adapter.debank.RawToken;
import com.navtracker.ingestion.adapter.pricing.SpotPriceClient;
import com.navtracker.ingestion.config.SpamTokenProperties;
import com.navtracker.ingestion.position.ProtocolDeduplicator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletEnricherTest {

    @Mock
    SpotPriceClient spotPriceClient;

    WalletEnricher enricher;

    @BeforeEach
    void setUp() {
        enricher = new WalletEnricher(new SpamTokenFilter(new SpamTokenProperties()), new ProtocolDeduplicator(), spotPriceClient);
    }

    @Test
    @DisplayName("spot price wins over upstream price and wrapped symbols use the unwrapped price")
    void pricePrecedence() {
        when(spotPriceClient.pricesBySymbol(any())).thenReturn(Map.of("eth", new BigDecimal("3000")));

        EnrichedWallet wallet = enricher.enrich("0xw", List.of(
                token("ETH", 2.0, 2900.0),
                token("WETH", 1.0, 2950.0),
                token("LINK", 10.0, 15.0)), List.of());

        assertThat(wallet.tokens()).extracting(TokenHolding::getPrice)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("3000"), new BigDecimal("3000"), new BigDecimal("15"));
        assertThat(wallet.tokensValue()).isEqualByComparingTo("9150");
        assertThat(wallet.chainDistribution().get("eth")).isEqualByComparingTo("9150");
    }

    @Test
    @DisplayName("spam tokens are excluded from the token value")
    void excludesSpam() {
        when(spotPriceClient.pricesBySymbol(any())).thenReturn(Map.of());

        EnrichedWallet wallet = enricher.enrich("0xw", List.of(
                token("USDC", 100.0, 1.0),
                token("CLAIM-REWARDS", 1_000_000.0, 1.0)), List.of());

        assertThat(wallet.tokens()).hasSize(1);
        assertThat(wallet.tokensValue()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("positions carry stable ids, reward value as unclaimed and a default name")
    void buildsPositions() {
        when(spotPriceClient.pricesBySymbol(any())).thenReturn(Map.of());
        RawPosition position = new RawPosition(null, new RawPosition.Pool("0xPool", "pool"),
                new RawPosition.Detail(
                        List.of(token("USDC", 1000.0, 1.0)),
                        List.of(token("ARB", 20.0, 1.5)),
                        List.of(token("ETH", 0.1, 3000.0)),
                        null, null),
                null, null);
        RawProtocol protocol = new RawProtocol("arb_aave3", "arb", "Aave V3", 1030.0, null, null, null, null,
                List.of(position, position));

        EnrichedWallet wallet = enricher.enrich("0xw", List.of(), List.of(protocol));

        assertThat(wallet.positions()).hasSize(1);
        PositionRecord record = wallet.positions().get(0);
        assertThat(record.getPositionId()).isEqualTo("arb:arb_aave3:0xpool");
        assertThat(record.getPositionName()).isEqualTo("Aave V3_position");
        assertThat(record.getTotalUsdValue()).isEqualByComparingTo("1030");
        assertThat(record.getUnclaimedRewardsUsd()).isEqualByComparingTo("30");
        assertThat(wallet.positionsValue()).isEqualByComparingTo("1030");
        assertThat(wallet.unclaimedRewardsValue()).isEqualByComparingTo("30");
        assertThat(wallet.protocolDistribution()).containsKey("Aave V3");
    }

    private static RawToken token(String symbol, double amount, double price) {
        return new RawToken(symbol.toLowerCase(), "eth", symbol, symbol, amount, price, 18, null, true);
    }
}
