package com.overseer.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * An entry in the Overseer's message log.
 *
 * @param id        unique message id
 * @param direction inbound (to the Overseer) or outbound (from the Overseer)
 * @param kind      directive, report, question, answer or notification
 * @param content   free text
 * @param relatedId optional id of the crew, agent or request this message refers to
 * @param context   extra key-value data, see {@link ContextValues}
 * @param timestamp when the message was logged
 * @param read      whether the Overseer has marked the message as read
 */
public record Message(
    UUID id,
    MessageDirection direction,
    MessageKind kind,
    String content,
    String relatedId,
    Map<String, Object> context,
    Instant timestamp,
    boolean read
) implements Serializable {

    public Message {
        context = ContextValues.copyOf(context);
    }

    public Message markedRead() {
        return read ? this : new Message(id, direction, kind, content, relatedId, context, timestamp, true);
    }
}
