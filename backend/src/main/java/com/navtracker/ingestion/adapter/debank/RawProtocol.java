package com.navtracker.ingestion.adapter.debank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Protocol entry of the complex protocol list. The same name may appear more than once in one fetch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawProtocol(
        String id,
        String chain,
        String name,
        @JsonProperty("net_usd_value") Double netUsdValue,
        @JsonProperty("asset_usd_value") Double assetUsdValue,
        @JsonProperty("debt_usd_value") Double debtUsdValue,
        @JsonProperty("logo_url") String logoUrl,
        @JsonProperty("site_url") String siteUrl,
        @JsonProperty("portfolio_item_list") List<RawPosition> portfolioItems
) {

    public List<RawPosition> positions() {
        return portfolioItems == null ? List.of() : portfolioItems;
    }
}
