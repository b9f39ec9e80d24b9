package com.navtracker.apy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How much a computed APY can be trusted. Results of every level are returned.
 */
public enum ApyConfidence {
    /** Full requested window of continuous active history, value within the sane band. */
    @JsonProperty("high")
    HIGH,
    /** History present but with gaps, or rewards were claimed inside the window. */
    @JsonProperty("medium")
    MEDIUM,
    /** New or reactivated position, degenerate window, or an outlier value. */
    @JsonProperty("low")
    LOW;

    public ApyConfidence atMost(ApyConfidence cap) {
        return ordinal() >= cap.ordinal() ? this : cap;
    }
}
