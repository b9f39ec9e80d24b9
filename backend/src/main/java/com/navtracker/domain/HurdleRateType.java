package com.navtracker.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum HurdleRateType {
    @JsonProperty("annual")
    ANNUAL,
    @JsonProperty("monthly")
    MONTHLY
}
