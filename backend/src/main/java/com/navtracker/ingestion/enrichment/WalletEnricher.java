package com.navtracker.ingestion.enrichment;

import com.navtracker.common.UsdAmounts;
import com.navtracker.domain.PositionRecord;
import com.navtracker.domain.TokenHolding;
import com.navtracker.ingestion.adapter.debank.RawPosition;
import com.navtracker.ingestion.adapter.debank.RawProtocol;
import com.navtracker.ingestion.adapter.debank.RawToken;
import com.navtracker.ingestion.adapter.pricing.SpotPriceClient;
import com.navtracker.ingestion.position.DedupedProtocol;
import com.navtracker.ingestion.position.PositionIdentity;
import com.navtracker.ingestion.position.ProtocolDeduplicator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw upstream tokens and protocols into an {@link EnrichedWallet}: drops spam tokens, prices tokens,
 * deduplicates protocols and builds position records with stable ids.
 * Token price precedence: spot price by symbol, spot price of the unwrapped symbol (leading 'w' removed),
 * upstream price, zero.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WalletEnricher {

    private final SpamTokenFilter spamTokenFilter;
    private final ProtocolDeduplicator protocolDeduplicator;
    private final SpotPriceClient spotPriceClient;

    public EnrichedWallet enrich(String walletAddress, List<RawToken> rawTokens, List<RawProtocol> rawProtocols) {
        List<RawToken> tokens = spamTokenFilter.filter(rawTokens);
        Map<String, BigDecimal> spotPrices = spotPriceClient.pricesBySymbol(lookupSymbols(tokens));

        List<TokenHolding> holdings = tokens.stream()
                .map(t -> toHolding(t, t.chain(), resolvePrice(t, spotPrices)))
                .toList();

        List<DedupedProtocol> protocols = protocolDeduplicator.dedupe(rawProtocols);
        log.debug("Deduplicated protocols {} -> {} for wallet {}",
                rawProtocols == null ? 0 : rawProtocols.size(), protocols.size(), walletAddress);

        List<PositionRecord> positions = new ArrayList<>();
        Map<String, BigDecimal> chainDistribution = new LinkedHashMap<>();
        Map<String, BigDecimal> protocolDistribution = new LinkedHashMap<>();
        BigDecimal positionsValue = BigDecimal.ZERO;
        BigDecimal unclaimed = BigDecimal.ZERO;
        for (DedupedProtocol protocol : protocols) {
            positionsValue = positionsValue.add(protocol.netUsdValue());
            protocolDistribution.merge(protocol.name(), protocol.netUsdValue(), BigDecimal::add);
            chainDistribution.merge(chainKey(protocol.chain()), protocol.netUsdValue(), BigDecimal::add);
            for (RawPosition position : protocol.positions()) {
                PositionRecord record = toPositionRecord(protocol, position);
                unclaimed = unclaimed.add(record.getUnclaimedRewardsUsd());
                positions.add(record);
            }
        }

        BigDecimal tokensValue = BigDecimal.ZERO;
        for (TokenHolding holding : holdings) {
            tokensValue = tokensValue.add(holding.getUsdValue());
            chainDistribution.merge(chainKey(holding.getChain()), holding.getUsdValue(), BigDecimal::add);
        }

        log.debug("Wallet {}: {} tokens ${}, {} protocols ${}, {} positions",
                walletAddress, holdings.size(), tokensValue, protocols.size(), positionsValue, positions.size());
        return new EnrichedWallet(walletAddress, holdings, protocols, positions, tokensValue, positionsValue,
                unclaimed, chainDistribution, protocolDistribution);
    }

    static BigDecimal resolvePrice(RawToken token, Map<String, BigDecimal> spotPrices) {
        String symbol = token.symbol() == null ? "" : token.symbol().toLowerCase(Locale.ROOT);
        BigDecimal spot = spotPrices.get(symbol);
        if (spot != null) {
            return spot;
        }
        if (symbol.startsWith("w") && symbol.length() > 1) {
            BigDecimal unwrapped = spotPrices.get(symbol.substring(1));
            if (unwrapped != null) {
                return unwrapped;
            }
        }
        return UsdAmounts.sanitize(token.price());
    }

    private PositionRecord toPositionRecord(DedupedProtocol protocol, RawPosition position) {
        List<TokenHolding> supply = position.supplyTokens().stream()
                .filter(t -> t != null)
                .map(t -> toHolding(t, protocol.chain(), UsdAmounts.sanitize(t.price())))
                .toList();
        List<TokenHolding> rewards = position.rewardTokens().stream()
                .filter(t -> t != null)
                .map(t -> toHolding(t, protocol.chain(), UsdAmounts.sanitize(t.price())))
                .toList();
        BigDecimal supplyValue = supply.stream().map(TokenHolding::getUsdValue).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal rewardValue = rewards.stream().map(TokenHolding::getUsdValue).reduce(BigDecimal.ZERO, BigDecimal::add);

        String positionName = position.name() == null || position.name().isBlank()
                ? protocol.name() + "_position"
                : position.name();
        return new PositionRecord()
                .setPositionId(PositionIdentity.positionId(protocol, position))
                .setProtocolId(protocol.id())
                .setProtocolName(protocol.name())
                .setChain(protocol.chain())
                .setPositionName(positionName)
                .setPoolId(position.poolId())
                .setSupplyTokens(supply)
                .setRewardTokens(rewards)
                .setTotalUsdValue(supplyValue.add(rewardValue))
                .setUnclaimedRewardsUsd(rewardValue);
    }

    private static TokenHolding toHolding(RawToken token, String chain, BigDecimal price) {
        BigDecimal amount = UsdAmounts.sanitize(token.amount());
        return new TokenHolding()
                .setSymbol(token.symbol())
                .setName(token.name())
                .setChain(chain)
                .setAmount(amount)
                .setPrice(price)
                .setUsdValue(UsdAmounts.value(amount, price))
                .setDecimals(token.decimals())
                .setLogoUrl(token.logoUrl())
                .setVerified(Boolean.TRUE.equals(token.verified()));
    }

    private static Set<String> lookupSymbols(List<RawToken> tokens) {
        Set<String> symbols = new LinkedHashSet<>();
        for (RawToken token : tokens) {
            if (token.symbol() == null || token.symbol().isBlank()) {
                continue;
            }
            String symbol = token.symbol().toLowerCase(Locale.ROOT);
            symbols.add(symbol);
            if (symbol.startsWith("w") && symbol.length() > 1) {
                symbols.add(symbol.substring(1));
            }
        }
        return symbols;
    }

    private static String chainKey(String chain) {
        return chain == null || chain.isBlank() ? TokenHolding.UNKNOWN_CHAIN : chain;
    }
}
