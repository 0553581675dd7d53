package com.overseer.core.registry;

import com.overseer.core.model.ApprovalKind;
import com.overseer.core.model.ApprovalRequest;
import com.overseer.core.model.Escalation;
import com.overseer.core.model.Report;

import java.util.Map;

/**
 * The part of the Overseer a registered crew may call back into.
 */
public interface OverseerChannel {

    String overseerId();

    void receiveReport(Report report);

    void receiveEscalation(Escalation escalation);

    ApprovalRequest requestApproval(ApprovalKind kind, String description, String requesterId,
                                    String requesterName, Map<String, Object> details);
}
