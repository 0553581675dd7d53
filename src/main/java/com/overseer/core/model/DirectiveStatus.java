package com.overseer.core.model;

/**
 * Status of a directive after it has been handed to a crew or directive manager.
 */
public enum DirectiveStatus {
    PENDING,
    ACCEPTED,
    IN_PROGRESS,
    COMPLETED,
    REJECTED
}
