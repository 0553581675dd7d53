package com.overseer.core.model;

/**
 * Priority of a directive issued by the Overseer.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
