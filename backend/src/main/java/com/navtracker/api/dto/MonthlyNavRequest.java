package com.navtracker.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

public record MonthlyNavRequest(
        @NotNull(message = "INVALID_REQUEST")
        LocalDate date,

        @NotNull(message = "INVALID_REQUEST")
        BigDecimal nav
) {
}
