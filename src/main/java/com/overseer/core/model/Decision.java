package com.overseer.core.model;

/**
 * Outcome the Overseer can give to a pending approval request.
 */
public enum Decision {
    APPROVE(ApprovalStatus.APPROVED),
    REJECT(ApprovalStatus.REJECTED),
    AMEND(ApprovalStatus.AMENDED);

    private final ApprovalStatus resultingStatus;

    Decision(ApprovalStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public ApprovalStatus resultingStatus() {
        return resultingStatus;
    }
}
