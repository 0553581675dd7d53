package com.overseer.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus} and {@link EventPublisher}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static OverseerEvent event(EventType type, String subjectId) {
        return new OverseerEvent(type, "OVS-1", subjectId, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to subscriber of its type")
        void deliversEventToTypeSubscriber() {
            List<OverseerEvent> received = new ArrayList<>();
            eventBus.subscribe(EventType.REQUEST_FILED, received::add);

            var event = event(EventType.REQUEST_FILED, "REQ-1");
            eventBus.publish(event);

            assertEquals(1, received.size());
            assertEquals(event, received.get(0));
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different type")
        void doesNotDeliverToDifferentType() {
            List<OverseerEvent> received = new ArrayList<>();
            eventBus.subscribe(EventType.DIRECTIVE_GIVEN, received::add);

            eventBus.publish(event(EventType.REPORT_RECEIVED, "R-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversMultipleEventsInOrder() {
            List<OverseerEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(EventType.ESCALATION_RECEIVED, "E-1"));
            eventBus.publish(event(EventType.REQUEST_FILED, "REQ-1"));
            eventBus.publish(event(EventType.REQUEST_DECIDED, "REQ-1"));

            assertEquals(3, received.size());
            assertEquals(EventType.ESCALATION_RECEIVED, received.get(0).eventType());
            assertEquals(EventType.REQUEST_FILED, received.get(1).eventType());
            assertEquals(EventType.REQUEST_DECIDED, received.get(2).eventType());
        }

        @Test
        @DisplayName("global and type-specific subscribers both receive the event")
        void globalAndTypeSpecificBothReceive() {
            List<OverseerEvent> globalReceived = new ArrayList<>();
            List<OverseerEvent> typeReceived = new ArrayList<>();
            eventBus.subscribeAll(globalReceived::add);
            eventBus.subscribe(EventType.DIRECTIVE_GIVEN, typeReceived::add);

            eventBus.publish(event(EventType.DIRECTIVE_GIVEN, "D-1"));

            assertEquals(1, globalReceived.size());
            assertEquals(1, typeReceived.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<OverseerEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe(EventType.REPORT_RECEIVED, received::add);

            eventBus.publish(event(EventType.REPORT_RECEIVED, "R-1"));
            subscription.unsubscribe();
            eventBus.publish(event(EventType.REPORT_RECEIVED, "R-2"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing global subscription stops delivery")
        void unsubscribeGlobalStopsDelivery() {
            List<OverseerEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            eventBus.publish(event(EventType.REQUEST_FILED, "REQ-1"));
            subscription.unsubscribe();
            eventBus.publish(event(EventType.REQUEST_FILED, "REQ-2"));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("fault isolation")
    class FaultIsolationTests {

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionDoesNotPreventOthers() {
            List<OverseerEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(EventType.REQUEST_FILED, "REQ-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("publisher swallows sink failures")
        void publisherSwallowsSinkFailures() {
            var publisher = new EventPublisher(e -> {
                throw new IllegalStateException("transport down");
            });
            assertDoesNotThrow(() -> publisher.publish(event(EventType.REPORT_RECEIVED, "R-1")));
        }

        @Test
        @DisplayName("publisher without a sink is a no-op")
        void publisherWithoutSink() {
            assertDoesNotThrow(() -> new EventPublisher(null).publish(event(EventType.REPORT_RECEIVED, "R-1")));
        }
    }

    @Test
    @DisplayName("handles concurrent publishes safely")
    void handlesConcurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<OverseerEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(EventType.REPORT_RECEIVED, received::add);

        int threadCount = 10;
        int eventsPerThread = 100;
        CountDownLatch latch = new CountDownLatch(threadCount);

        for (int t = 0; t < threadCount; t++) {
            final int threadId = t;
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(event(EventType.REPORT_RECEIVED, threadId + "-" + i));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }
}
