package com.overseer.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub implementation of {@link EventSink}.
 * <p>
 * Supports per-type subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
public class EventBus implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-type subscribers. */
    private final ConcurrentHashMap<EventType, CopyOnWriteArrayList<Consumer<OverseerEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<OverseerEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (type-specific and global).
     *
     * @param event the event to publish
     */
    @Override
    public void publish(OverseerEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType().key(), event.subjectId());

        List<Consumer<OverseerEvent>> typeSubs = typeSubscribers.get(event.eventType());
        if (typeSubs != null) {
            for (Consumer<OverseerEvent> subscriber : typeSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<OverseerEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one type.
     *
     * @param type     the event type to receive
     * @param consumer callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(EventType type, Consumer<OverseerEvent> consumer) {
        typeSubscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", type.key());
        return () -> {
            CopyOnWriteArrayList<Consumer<OverseerEvent>> subs = typeSubscribers.get(type);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to all events.
     *
     * @param consumer callback invoked for every event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<OverseerEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OverseerEvent> subscriber, OverseerEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType().key(), e.getMessage(), e);
        }
    }
}
