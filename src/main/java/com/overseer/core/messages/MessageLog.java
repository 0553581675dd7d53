package com.overseer.core.messages;

import com.overseer.core.model.Message;
import com.overseer.core.model.MessageDirection;
import com.overseer.core.model.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Append-only, insertion-ordered record of everything the Overseer sent and received.
 * <p>
 * Messages are never edited or removed; the only mutation is {@link #markRead(UUID)}.
 * The optional observer runs after the append has completed, outside the lock.
 */
public class MessageLog {

    private static final Logger log = LoggerFactory.getLogger(MessageLog.class);

    private final List<Message> messages = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Consumer<Message> observer;

    public MessageLog() {
        this(Clock.systemUTC(), null);
    }

    public MessageLog(Clock clock, Consumer<Message> observer) {
        this.clock = clock;
        this.observer = observer;
    }

    public Message append(MessageDirection direction, MessageKind kind, String content,
                          String relatedId, Map<String, Object> context) {
        Message message;
        lock.writeLock().lock();
        try {
            message = new Message(UUID.randomUUID(), direction, kind, content == null ? "" : content,
                    relatedId, context, clock.instant(), false);
            messages.add(message);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Logged {} {} message {}", direction, kind, message.id());
        notifyObserver(message);
        return message;
    }

    /**
     * @return true if the message exists; marking an already read message again is allowed
     */
    public boolean markRead(UUID id) {
        lock.writeLock().lock();
        try {
            for (int i = 0; i < messages.size(); i++) {
                Message message = messages.get(i);
                if (message.id().equals(id)) {
                    messages.set(i, message.markedRead());
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** All messages in arrival order. */
    public List<Message> messages() {
        lock.readLock().lock();
        try {
            return List.copyOf(messages);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Message> messages(MessageKind kind) {
        lock.readLock().lock();
        try {
            return messages.stream().filter(m -> m.kind() == kind).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Message> unread(MessageKind kind) {
        lock.readLock().lock();
        try {
            return messages.stream().filter(m -> m.kind() == kind && !m.read()).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return messages.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Replace the log contents, e.g. from a snapshot. The observer is not notified. */
    public void restore(Collection<Message> restored) {
        lock.writeLock().lock();
        try {
            messages.clear();
            messages.addAll(restored);
            log.info("Restored {} messages", messages.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void notifyObserver(Message message) {
        if (observer == null) {
            return;
        }
        try {
            observer.accept(message);
        } catch (Exception e) {
            log.warn("Message observer failed for message {}: {}", message.id(), e.getMessage(), e);
        }
    }
}
