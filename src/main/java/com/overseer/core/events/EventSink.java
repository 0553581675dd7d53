package com.overseer.core.events;

/**
 * Fire-and-forget destination for {@link OverseerEvent}s.
 */
@FunctionalInterface
public interface EventSink {

    void publish(OverseerEvent event);
}
