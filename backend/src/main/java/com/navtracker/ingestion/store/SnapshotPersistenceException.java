package com.navtracker.ingestion.store;

import lombok.Getter;

/**
 * Thrown when a snapshot or position history write fails. Carries the (userId, walletAddress) being written;
 * never recovered locally.
 */
@Getter
public class SnapshotPersistenceException extends RuntimeException {

    private final String userId;
    private final String walletAddress;

    public SnapshotPersistenceException(String userId, String walletAddress, Throwable cause) {
        super("Failed to persist snapshot for user " + userId + ", wallet " + walletAddress + ": " + messageOf(cause), cause);
        this.userId = userId;
        this.walletAddress = walletAddress;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
