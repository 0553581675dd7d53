package com.overseer.core.registry;

import java.util.List;

/**
 * Optional capability of a {@link Target} that keeps track of whom it reports to.
 * <p>
 * On registration the registry appends the Overseer id to {@link #reportsTo()} (once) and
 * hands the target a channel back to the Overseer.
 */
public interface Supervisable {

    /** Current reporting lines, in the order they were added. */
    List<String> reportsTo();

    void addReportsTo(String supervisorId);

    void attachOverseer(OverseerChannel channel);
}
