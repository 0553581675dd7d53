package com.overseer.core.overseer;

/**
 * Point-in-time counts shown in answer to a status query.
 */
public record OverseerSummary(
    int unreadReports,
    int urgentReports,
    int pendingApprovals,
    int totalMessages,
    int registeredTargets
) {}
