package com.overseer.core.model;

/**
 * Lifecycle status of an {@link ApprovalRequest}.
 * <p>
 * The only legal transitions are {@code PENDING -> APPROVED | REJECTED | AMENDED}.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    AMENDED;  // approved with changes

    public boolean isTerminal() {
        return this != PENDING;
    }
}
