package com.navtracker.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spot price source. Documented in application.yml under navtracker.pricing.
 */
@ConfigurationProperties(prefix = "navtracker.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Timeout in seconds for one /simple/price call.
     */
    private int timeoutSeconds = 15;

    /**
     * Map: token symbol (lowercase) -> CoinGecko coin id. Symbols missing here keep the upstream price.
     */
    private Map<String, String> symbolToCoinGeckoId = new LinkedHashMap<>(Map.of(
            "eth", "ethereum",
            "btc", "bitcoin",
            "usdc", "usd-coin",
            "usdt", "tether",
            "dai", "dai",
            "bnb", "binancecoin",
            "matic", "matic-network",
            "arb", "arbitrum",
            "op", "optimism"));
}
