package com.navtracker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Error response: machine-readable code, message, per-field details for validation failures, timestamp.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorBody(String error, String message, List<String> details, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, List.of(), Instant.now());
    }

    public static ErrorBody of(String error, String message, List<String> details) {
        return new ErrorBody(error, message, details == null ? List.of() : List.copyOf(details), Instant.now());
    }
}
