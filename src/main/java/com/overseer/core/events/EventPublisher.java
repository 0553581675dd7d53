package com.overseer.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps an {@link EventSink} so that a failing sink never affects the caller.
 */
public final class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final EventSink sink;

    public EventPublisher(EventSink sink) {
        this.sink = sink;
    }

    public void publish(OverseerEvent event) {
        if (sink == null) {
            return;
        }
        try {
            sink.publish(event);
        } catch (Exception e) {
            log.warn("Event sink rejected {} for {}: {}", event.eventType().key(), event.subjectId(), e.getMessage(), e);
        }
    }
}
