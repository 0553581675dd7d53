package com.overseer.core.model;

import java.io.Serializable;
import java.util.UUID;

/**
 * A problem a crew escalates to the Overseer. Every escalation becomes an approval request.
 *
 * @param id         escalation id
 * @param sourceId   id of the escalating crew or agent (nullable)
 * @param sourceType display label for the source, e.g. "crew" or the crew name
 * @param reason     why the escalation was raised
 */
public record Escalation(
    UUID id,
    String sourceId,
    String sourceType,
    String reason
) implements Serializable {}
