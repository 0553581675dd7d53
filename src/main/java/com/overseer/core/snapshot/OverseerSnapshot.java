package com.overseer.core.snapshot;

import com.overseer.core.model.ApprovalRequest;
import com.overseer.core.model.Message;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Host-triggered copy of the Overseer's owned state.
 *
 * @param overseerId the Overseer the snapshot was taken from
 * @param takenAt    when the snapshot was taken
 * @param requests   every approval request, in filing order
 * @param messages   the message log, in arrival order
 */
public record OverseerSnapshot(
    String overseerId,
    Instant takenAt,
    List<ApprovalRequest> requests,
    List<Message> messages
) implements Serializable {

    public OverseerSnapshot {
        requests = requests == null ? List.of() : List.copyOf(requests);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
