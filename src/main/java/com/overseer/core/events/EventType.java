package com.overseer.core.events;

/**
 * Domain events emitted by the Overseer.
 */
public enum EventType {
    REQUEST_FILED("request.filed"),
    REQUEST_DECIDED("request.decided"),
    DIRECTIVE_GIVEN("directive.given"),
    REPORT_RECEIVED("report.received"),
    ESCALATION_RECEIVED("escalation.received");

    private final String key;

    EventType(String key) {
        this.key = key;
    }

    /** Dotted name used in logs and by external sinks. */
    public String key() {
        return key;
    }
}
