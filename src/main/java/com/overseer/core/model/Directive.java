package com.overseer.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * An instruction issued by the Overseer to a crew.
 *
 * @param id          unique directive id
 * @param requesterId id of the issuer (the Overseer)
 * @param targetId    id of the receiving crew or agent
 * @param title       short title, at most the configured maximum length
 * @param body        the full instruction text
 * @param priority    how urgently the crew should act
 * @param context     extra key-value data for the crew
 * @param status      delivery/execution status as reported by the receiver
 * @param issuedAt    creation time
 */
public record Directive(
    UUID id,
    String requesterId,
    String targetId,
    String title,
    String body,
    Priority priority,
    Map<String, Object> context,
    DirectiveStatus status,
    Instant issuedAt
) implements Serializable {

    public Directive {
        context = ContextValues.copyOf(context);
    }

    public static Directive create(String requesterId, String targetId, String title, String body,
                                   Priority priority, Map<String, Object> context, Instant issuedAt) {
        return new Directive(UUID.randomUUID(), requesterId, targetId, title, body, priority, context,
                DirectiveStatus.PENDING, issuedAt);
    }
}
