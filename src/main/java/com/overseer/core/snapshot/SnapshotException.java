package com.overseer.core.snapshot;

/**
 * Thrown when a snapshot cannot be written or read.
 */
public class SnapshotException extends RuntimeException {
    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
