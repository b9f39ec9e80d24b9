package com.navtracker.ingestion.adapter.debank;

/**
 * Thrown when an upstream call (aggregator or price source) fails: HTTP error, timeout or unreadable payload.
 */
public class UpstreamFetchException extends RuntimeException {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
