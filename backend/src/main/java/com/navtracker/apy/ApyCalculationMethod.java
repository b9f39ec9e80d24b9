package com.navtracker.apy;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ApyCalculationMethod {
    /** Rewards accrued between the two reference points, compounded over the elapsed days. */
    @JsonProperty("rewards_accrual")
    REWARDS_ACCRUAL,
    /** No earlier point: current unclaimed rewards over days since first seen (at least one). */
    @JsonProperty("new_position_rewards_rate")
    NEW_POSITION_REWARDS_RATE,
    /** Zero elapsed time or zero value; APY reported as 0. */
    @JsonProperty("insufficient_data")
    INSUFFICIENT_DATA
}
