package com.navtracker.ingestion.adapter.debank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token as returned by the aggregator, both in wallet token lists and inside position details.
 * Numeric fields are left nullable; sanitization happens when snapshot value objects are built.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawToken(
        String id,
        String chain,
        String name,
        String symbol,
        Double amount,
        Double price,
        Integer decimals,
        @JsonProperty("logo_url") String logoUrl,
        @JsonProperty("is_verified") Boolean verified
) {
}
