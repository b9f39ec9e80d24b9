package com.navtracker.ingestion.adapter.debank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One portfolio item of a protocol: supplied, reward and borrowed token lists plus an optional pool.
 * positionIndex tells apart several items of the same pool (e.g. one per LP NFT).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawPosition(
        String name,
        Pool pool,
        Detail detail,
        Stats stats,
        @JsonProperty("position_index") String positionIndex
) {

    public String poolId() {
        return pool == null ? null : pool.id();
    }

    public List<RawToken> supplyTokens() {
        return detail == null || detail.supplyTokens() == null ? List.of() : detail.supplyTokens();
    }

    public List<RawToken> rewardTokens() {
        return detail == null || detail.rewardTokens() == null ? List.of() : detail.rewardTokens();
    }

    public String portfolioItemId() {
        return detail == null ? null : detail.portfolioItemId();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Pool(String id, String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Detail(
            @JsonProperty("supply_token_list") List<RawToken> supplyTokens,
            @JsonProperty("reward_token_list") List<RawToken> rewardTokens,
            @JsonProperty("borrow_token_list") List<RawToken> borrowTokens,
            @JsonProperty("portfolio_item_id") String portfolioItemId,
            String description
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stats(
            @JsonProperty("net_usd_value") Double netUsdValue,
            @JsonProperty("asset_usd_value") Double assetUsdValue,
            @JsonProperty("debt_usd_value") Double debtUsdValue
    ) {
    }
}
