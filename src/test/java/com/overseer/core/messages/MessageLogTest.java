package com.overseer.core.messages;

import com.overseer.core.model.Message;
import com.overseer.core.model.MessageDirection;
import com.overseer.core.model.MessageKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MessageLogTest {

    private List<Message> observed;
    private MessageLog log;

    @BeforeEach
    void setUp() {
        observed = new ArrayList<>();
        log = new MessageLog(Clock.systemUTC(), observed::add);
    }

    @Test
    @DisplayName("appends keep arrival order and notify the observer")
    void appendOrder() {
        for (int i = 0; i < 20; i++) {
            log.append(MessageDirection.INBOUND, MessageKind.REPORT, "report " + i, null, Map.of());
        }

        List<Message> messages = log.messages();
        assertEquals(20, messages.size());
        for (int i = 0; i < 20; i++) {
            assertEquals("report " + i, messages.get(i).content());
            assertFalse(messages.get(i).read());
        }
        assertEquals(messages, observed);
    }

    @Test
    @DisplayName("null content is stored as empty text")
    void nullContent() {
        var message = log.append(MessageDirection.OUTBOUND, MessageKind.DIRECTIVE, null, null, null);
        assertEquals("", message.content());
        assertTrue(message.context().isEmpty());
    }

    @Test
    @DisplayName("markRead flips only the read flag")
    void markRead() {
        var report = log.append(MessageDirection.INBOUND, MessageKind.REPORT, "weekly", "crew-1",
                Map.of("priority", "HIGH"));
        log.append(MessageDirection.INBOUND, MessageKind.REPORT, "daily", "crew-2", Map.of());

        assertTrue(log.markRead(report.id()));
        assertTrue(log.markRead(report.id()));
        assertFalse(log.markRead(UUID.randomUUID()));

        var stored = log.messages().get(0);
        assertTrue(stored.read());
        assertEquals(report.content(), stored.content());
        assertEquals(report.timestamp(), stored.timestamp());
        assertEquals(1, log.unread(MessageKind.REPORT).size());
        assertEquals("daily", log.unread(MessageKind.REPORT).get(0).content());
    }

    @Test
    @DisplayName("messages can be filtered by kind")
    void filterByKind() {
        log.append(MessageDirection.OUTBOUND, MessageKind.DIRECTIVE, "@trading: hold", null, Map.of());
        log.append(MessageDirection.INBOUND, MessageKind.NOTIFICATION, "Escalation: liquidity", null, Map.of());
        log.append(MessageDirection.INBOUND, MessageKind.REPORT, "all fine", null, Map.of());

        assertEquals(1, log.messages(MessageKind.NOTIFICATION).size());
        assertTrue(log.messages(MessageKind.QUESTION).isEmpty());
        assertEquals(3, log.size());
    }

    @Test
    @DisplayName("a failing observer does not affect the log")
    void failingObserver() {
        var failing = new MessageLog(Clock.systemUTC(), m -> {
            throw new IllegalStateException("observer down");
        });

        var message = assertDoesNotThrow(() ->
                failing.append(MessageDirection.INBOUND, MessageKind.REPORT, "hello", null, Map.of()));

        assertEquals(List.of(message), failing.messages());
    }

    @Test
    @DisplayName("concurrent appends and reads lose no messages")
    void concurrentAppends() throws Exception {
        int threads = 8;
        int perThread = 200;
        var shared = new MessageLog(Clock.systemUTC(), m -> {});
        ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
        var start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                int writer = t;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        var m = shared.append(MessageDirection.INBOUND, MessageKind.REPORT,
                                writer + ":" + i, "crew-" + writer, Map.of());
                        if (i % 2 == 0) {
                            shared.markRead(m.id());
                        }
                    }
                    return null;
                });
            }
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    shared.unread(MessageKind.REPORT);
                    shared.messages();
                }
                return null;
            });
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        List<Message> messages = shared.messages();
        assertEquals(threads * perThread, messages.size());
        assertEquals(threads * perThread, messages.stream().map(Message::id).distinct().count());
        assertEquals(threads * perThread / 2, shared.unread(MessageKind.REPORT).size());
        for (int t = 0; t < threads; t++) {
            String prefix = t + ":";
            List<String> own = messages.stream().map(Message::content).filter(c -> c.startsWith(prefix)).toList();
            for (int i = 0; i < perThread; i++) {
                assertEquals(prefix + i, own.get(i));
            }
        }
    }

    @Test
    @DisplayName("restore replaces contents without notifying the observer")
    void restore() {
        var source = new MessageLog();
        var m1 = source.append(MessageDirection.INBOUND, MessageKind.REPORT, "one", null, Map.of());
        var m2 = source.append(MessageDirection.OUTBOUND, MessageKind.DIRECTIVE, "two", null, Map.of());

        log.restore(source.messages());

        assertEquals(List.of(m1, m2), log.messages());
        assertTrue(observed.isEmpty());
    }
}
