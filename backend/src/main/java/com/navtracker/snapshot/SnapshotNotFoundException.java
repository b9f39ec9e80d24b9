package com.navtracker.snapshot;

/**
 * No snapshot exists at or before the requested date.
 */
public class SnapshotNotFoundException extends RuntimeException {

    public static final String ERROR_CODE = "SNAPSHOT_NOT_FOUND";

    public SnapshotNotFoundException(String message) {
        super(message);
    }
}
