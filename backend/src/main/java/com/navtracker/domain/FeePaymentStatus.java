package com.navtracker.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payment state of the accrued performance fee for a reporting month. Set by the caller per period.
 */
public enum FeePaymentStatus {
    @JsonProperty("paid")
    PAID,
    @JsonProperty("not_paid")
    NOT_PAID,
    @JsonProperty("partially_paid")
    PARTIALLY_PAID
}
