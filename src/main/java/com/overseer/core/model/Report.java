package com.overseer.core.model;

import java.io.Serializable;
import java.util.UUID;

/**
 * A report sent up to the Overseer by a crew. Only the fields the Overseer reads are modelled.
 */
public record Report(
    UUID id,
    String fromId,
    String fromName,
    String title,
    String summary,
    ReportPriority priority
) implements Serializable {

    public Report {
        if (priority == null) {
            priority = ReportPriority.NORMAL;
        }
    }

    public boolean isUrgent() {
        return priority == ReportPriority.URGENT;
    }
}
