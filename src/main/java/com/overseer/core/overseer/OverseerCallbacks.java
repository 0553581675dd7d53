package com.overseer.core.overseer;

import com.overseer.core.model.ApprovalRequest;
import com.overseer.core.model.Escalation;
import com.overseer.core.model.Message;
import com.overseer.core.model.Report;

import java.util.function.Consumer;

/**
 * Optional UI hooks, invoked synchronously on the calling thread.
 * A slow callback delays the operation that triggered it.
 *
 * @param onReport           a crew sent a report
 * @param onApprovalRequired an approval request was filed
 * @param onEscalation       a crew escalated a problem
 * @param onMessage          a message was appended to the log
 */
public record OverseerCallbacks(
    Consumer<Report> onReport,
    Consumer<ApprovalRequest> onApprovalRequired,
    Consumer<Escalation> onEscalation,
    Consumer<Message> onMessage
) {

    public static OverseerCallbacks none() {
        return new OverseerCallbacks(null, null, null, null);
    }

    public OverseerCallbacks withOnReport(Consumer<Report> callback) {
        return new OverseerCallbacks(callback, onApprovalRequired, onEscalation, onMessage);
    }

    public OverseerCallbacks withOnApprovalRequired(Consumer<ApprovalRequest> callback) {
        return new OverseerCallbacks(onReport, callback, onEscalation, onMessage);
    }

    public OverseerCallbacks withOnEscalation(Consumer<Escalation> callback) {
        return new OverseerCallbacks(onReport, onApprovalRequired, callback, onMessage);
    }

    public OverseerCallbacks withOnMessage(Consumer<Message> callback) {
        return new OverseerCallbacks(onReport, onApprovalRequired, onEscalation, callback);
    }
}
