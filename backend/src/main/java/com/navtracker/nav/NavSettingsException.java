package com.navtracker.nav;

import lombok.Getter;

/**
 * Thrown by NavSettingsService when a request is invalid or a NAV record cannot be read or written.
 * ApiExceptionHandler maps INVALID_* to 400, NAV_NOT_FOUND to 404 and PERSISTENCE_FAILURE to 500.
 */
@Getter
public class NavSettingsException extends RuntimeException {

    public static final String INVALID_PERIOD = "INVALID_PERIOD";
    public static final String INVALID_FEE_SETTINGS = "INVALID_FEE_SETTINGS";
    public static final String NAV_NOT_FOUND = "NAV_NOT_FOUND";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String PERSISTENCE_FAILURE = "PERSISTENCE_FAILURE";

    private final String errorCode;

    public NavSettingsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public NavSettingsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
