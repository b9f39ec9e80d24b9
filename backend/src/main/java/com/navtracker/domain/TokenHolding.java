package com.navtracker.domain;

import com.navtracker.common.UsdAmounts;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.math.BigDecimal;

/**
 * Token line embedded in daily snapshots and position history. Numeric fields are sanitized on write:
 * never null, never negative.
 */
@NoArgsConstructor
@Getter
@Setter
@Accessors(chain = true)
public class TokenHolding {

    public static final String UNKNOWN_SYMBOL = "UNKNOWN";
    public static final String UNKNOWN_CHAIN = "unknown";
    public static final int DEFAULT_DECIMALS = 18;

    private String symbol = UNKNOWN_SYMBOL;
    private String name = "";
    private String chain = UNKNOWN_CHAIN;
    private BigDecimal amount = BigDecimal.ZERO;
    private BigDecimal price = BigDecimal.ZERO;
    private BigDecimal usdValue = BigDecimal.ZERO;
    private int decimals = DEFAULT_DECIMALS;
    private String logoUrl = "";
    private boolean verified;

    public TokenHolding setSymbol(String symbol) {
        this.symbol = symbol == null || symbol.isBlank() ? UNKNOWN_SYMBOL : symbol;
        return this;
    }

    public TokenHolding setName(String name) {
        this.name = name == null ? "" : name;
        return this;
    }

    public TokenHolding setChain(String chain) {
        this.chain = chain == null || chain.isBlank() ? UNKNOWN_CHAIN : chain;
        return this;
    }

    public TokenHolding setAmount(BigDecimal amount) {
        this.amount = UsdAmounts.sanitize(amount);
        return this;
    }

    public TokenHolding setPrice(BigDecimal price) {
        this.price = UsdAmounts.sanitize(price);
        return this;
    }

    public TokenHolding setUsdValue(BigDecimal usdValue) {
        this.usdValue = UsdAmounts.sanitize(usdValue);
        return this;
    }

    public TokenHolding setDecimals(Integer decimals) {
        this.decimals = decimals == null || decimals < 0 ? DEFAULT_DECIMALS : decimals;
        return this;
    }

    public TokenHolding setLogoUrl(String logoUrl) {
        this.logoUrl = logoUrl == null ? "" : logoUrl;
        return this;
    }
}
