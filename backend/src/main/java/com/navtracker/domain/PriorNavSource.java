package com.navtracker.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where FeeSettings.priorPreFeeNav came from.
 */
public enum PriorNavSource {
    @JsonProperty("manual")
    MANUAL,
    /** Copied from the previous month's stored preFeeNav. */
    @JsonProperty("auto_loaded")
    AUTO_LOADED,
    /** First-month setup: current portfolio value used as the baseline. */
    @JsonProperty("portfolio_estimate")
    PORTFOLIO_ESTIMATE,
    /** No previous month; the caller should offer a portfolio estimate. */
    @JsonProperty("fallback_needed")
    FALLBACK_NEEDED
}
