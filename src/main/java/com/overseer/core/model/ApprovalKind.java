package com.overseer.core.model;

/**
 * What an approval request asks the Overseer to sign off on.
 */
public enum ApprovalKind {
    DIRECTIVE,
    ESCALATION,
    BUDGET,
    STRATEGY
}
