package com.navtracker.ingestion.adapter.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.navtracker.config.CaffeineConfig;
import com.navtracker.ingestion.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves spot USD prices by token symbol via CoinGecko /simple/price. Only symbols present in
 * symbolToCoinGeckoId are looked up. Cache TTL 5min.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpotPriceClient {

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    /**
     * Returns lowercase symbol -> USD price for every symbol CoinGecko priced. Symbols without a mapping, and
     * every symbol when the call fails, are simply absent: callers fall back to the upstream price.
     */
    @Cacheable(cacheNames = CaffeineConfig.SPOT_PRICE_CACHE,
            key = "T(java.lang.String).join(',', new java.util.TreeSet(#symbols))")
    public Map<String, BigDecimal> pricesBySymbol(Collection<String> symbols) {
        Map<String, Set<String>> symbolsByCoinId = new LinkedHashMap<>();
        for (String symbol : new TreeSet<>(symbols)) {
            String coinId = pricingProperties.getSymbolToCoinGeckoId().get(symbol.toLowerCase(Locale.ROOT));
            if (coinId != null && !coinId.isBlank()) {
                symbolsByCoinId.computeIfAbsent(coinId, k -> new LinkedHashSet<>()).add(symbol.toLowerCase(Locale.ROOT));
            }
        }
        if (symbolsByCoinId.isEmpty()) {
            return Map.of();
        }
        String ids = String.join(",", symbolsByCoinId.keySet());
        try {
            String response = webClientBuilder.build().get()
                    .uri(pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids={ids}&vs_currencies=usd", ids)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(Math.max(1, pricingProperties.getTimeoutSeconds())));
            return parse(response, symbolsByCoinId);
        } catch (Exception e) {
            log.warn("CoinGecko spot prices failed for {}: {}", ids, e.getMessage());
            return Map.of();
        }
    }

    Map<String, BigDecimal> parse(String json, Map<String, Set<String>> symbolsByCoinId) throws Exception {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return prices;
        }
        JsonNode root = objectMapper.readTree(json);
        symbolsByCoinId.forEach((coinId, coinSymbols) -> {
            JsonNode usd = root.path(coinId).path("usd");
            if (usd.isNumber() && usd.decimalValue().signum() > 0) {
                coinSymbols.forEach(symbol -> prices.put(symbol, usd.decimalValue()));
            }
        });
        return prices;
    }
}
