package com.navtracker.api.controller;

import com.navtracker.api.dto.ErrorBody;
import com.navtracker.ingestion.store.SnapshotPersistenceException;
import com.navtracker.nav.NavSettingsException;
import com.navtracker.snapshot.SnapshotNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.Optional;

/**
 * Maps service and validation failures to ErrorBody: invalid input 400, missing data 404, persistence 500.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String PERSISTENCE_FAILURE = "PERSISTENCE_FAILURE";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse(INVALID_REQUEST);
        List<String> details = ex.getFieldErrors().stream()
                .map(e -> e.getField() + " is required")
                .distinct()
                .toList();
        String message = details.isEmpty() ? "Validation failed" : details.get(0);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message, details));
    }

    /** Malformed JSON, non-numeric amounts and unparsable path or query values. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";
        return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_REQUEST, message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(NavSettingsException.class)
    public ResponseEntity<ErrorBody> handleNav(NavSettingsException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case NavSettingsException.NAV_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NavSettingsException.PERSISTENCE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
        if (status.is5xxServerError()) {
            log.error("NAV request failed: {}", ex.getMessage(), ex);
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(SnapshotNotFoundException.class)
    public ResponseEntity<ErrorBody> handleSnapshotNotFound(SnapshotNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of(SnapshotNotFoundException.ERROR_CODE, ex.getMessage()));
    }

    @ExceptionHandler(SnapshotPersistenceException.class)
    public ResponseEntity<ErrorBody> handlePersistence(SnapshotPersistenceException ex) {
        log.error("Snapshot persistence failed for user {} wallet {}", ex.getUserId(), ex.getWalletAddress(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of(PERSISTENCE_FAILURE, ex.getMessage()));
    }
}
