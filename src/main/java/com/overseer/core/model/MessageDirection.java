package com.overseer.core.model;

/**
 * Direction of a logged message relative to the Overseer.
 */
public enum MessageDirection {
    /** Sent to the Overseer by a crew. */
    INBOUND,
    /** Issued by the Overseer. */
    OUTBOUND
}
