package com.overseer.core.events;

import com.overseer.core.model.ApprovalRequest;
import com.overseer.core.model.Directive;
import com.overseer.core.model.Escalation;
import com.overseer.core.model.Report;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted by the Overseer for external observers.
 *
 * @param eventType  what happened
 * @param overseerId the emitting Overseer
 * @param subjectId  id of the request, directive, report or escalation the event is about
 * @param payload    event-specific fields (never null, null values omitted)
 * @param timestamp  when the event happened, taken from the emitter's clock
 */
public record OverseerEvent(
    EventType eventType,
    String overseerId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static OverseerEvent requestFiled(String overseerId, ApprovalRequest request) {
        return of(EventType.REQUEST_FILED, overseerId, request.id().toString(), request.requestedAt(),
                "kind", request.kind().name(),
                "description", request.description(),
                "requesterId", request.requesterId(),
                "requesterName", request.requesterName());
    }

    public static OverseerEvent requestDecided(String overseerId, ApprovalRequest request) {
        return of(EventType.REQUEST_DECIDED, overseerId, request.id().toString(), request.decidedAt(),
                "decision", request.status().name(),
                "note", request.decisionNote());
    }

    public static OverseerEvent directiveGiven(String overseerId, Directive directive, String targetName, Instant at) {
        return of(EventType.DIRECTIVE_GIVEN, overseerId, directive.id().toString(), at,
                "targetId", directive.targetId(),
                "targetName", targetName,
                "title", directive.title(),
                "priority", directive.priority().name());
    }

    public static OverseerEvent reportReceived(String overseerId, Report report, Instant at) {
        return of(EventType.REPORT_RECEIVED, overseerId, report.id() == null ? null : report.id().toString(), at,
                "fromId", report.fromId(),
                "fromName", report.fromName(),
                "summary", report.summary(),
                "priority", report.priority().name());
    }

    public static OverseerEvent escalationReceived(String overseerId, Escalation escalation, ApprovalRequest filed) {
        return of(EventType.ESCALATION_RECEIVED, overseerId,
                escalation.id() == null ? null : escalation.id().toString(), filed.requestedAt(),
                "sourceId", escalation.sourceId(),
                "reason", escalation.reason(),
                "requestId", filed.id().toString());
    }

    private static OverseerEvent of(EventType type, String overseerId, String subjectId, Instant timestamp,
                                    Object... keyValues) {
        var payload = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                payload.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return new OverseerEvent(type, overseerId, subjectId, Map.copyOf(payload), timestamp);
    }
}
