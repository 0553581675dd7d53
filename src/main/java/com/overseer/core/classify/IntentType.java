package com.overseer.core.classify;

/**
 * Structured intent a line of Overseer input is routed by.
 */
public enum IntentType {
    /** {@code @target: instruction} addressed to a crew. */
    DIRECTIVE,
    /** Approval or rejection of a pending request. */
    DECISION,
    /** A question about the state of the organisation. */
    QUERY,
    /** Anything else. */
    GENERAL
}
