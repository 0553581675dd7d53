package com.overseer.core.model;

public enum ReportPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
