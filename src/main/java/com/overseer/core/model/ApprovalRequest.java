package com.overseer.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A decision item raised by a crew that waits for the Overseer.
 * <p>
 * Instances are immutable; the ledger replaces the stored value when a decision is recorded.
 *
 * @param id            generated at filing time
 * @param kind          what is being asked for
 * @param description   free text shown to the Overseer
 * @param requesterId   id of the crew or agent that filed the request
 * @param requesterName display name of the requester
 * @param details       supplementary context, see {@link ContextValues}
 * @param status        current lifecycle status
 * @param requestedAt   filing time
 * @param decidedAt     time of the first terminal transition (null while pending)
 * @param decisionNote  note given with the decision (null while pending)
 * @param sequence      filing order within the ledger, breaks ties on {@code requestedAt}
 */
public record ApprovalRequest(
    UUID id,
    ApprovalKind kind,
    String description,
    String requesterId,
    String requesterName,
    Map<String, Object> details,
    ApprovalStatus status,
    Instant requestedAt,
    Instant decidedAt,
    String decisionNote,
    long sequence
) implements Serializable {

    public static final String UNKNOWN_REQUESTER = "Unknown";

    public ApprovalRequest {
        details = ContextValues.copyOf(details);
    }

    public static ApprovalRequest pending(ApprovalKind kind, String description, String requesterId,
                                          String requesterName, Map<String, Object> details,
                                          Instant requestedAt, long sequence) {
        String name = (requesterName == null || requesterName.isBlank()) ? UNKNOWN_REQUESTER : requesterName;
        return new ApprovalRequest(UUID.randomUUID(), kind, description, requesterId, name, details,
                ApprovalStatus.PENDING, requestedAt, null, null, sequence);
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    /**
     * Returns a copy carrying the given decision. Callers must check {@link #isPending()} first.
     */
    public ApprovalRequest decided(Decision decision, String note, Instant at) {
        return new ApprovalRequest(id, kind, description, requesterId, requesterName, details,
                decision.resultingStatus(), requestedAt, at, note == null ? "" : note, sequence);
    }
}
