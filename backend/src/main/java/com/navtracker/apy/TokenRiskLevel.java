package com.navtracker.apy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Price risk of a token from the spread of its period APYs.
 */
public enum TokenRiskLevel {
    @JsonProperty("low")
    LOW,
    @JsonProperty("medium")
    MEDIUM,
    @JsonProperty("high")
    HIGH,
    /** No period had an APY. */
    @JsonProperty("unknown")
    UNKNOWN
}
