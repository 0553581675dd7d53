package com.overseer.core.dispatch;

import com.overseer.core.model.Directive;
import com.overseer.core.model.Priority;

import java.util.Map;

/**
 * External collaborator that creates and delivers directives on the Overseer's behalf.
 * When one is configured the dispatcher always prefers it over direct delivery.
 */
public interface DirectiveManager {

    Directive issue(String requesterId, String targetId, String title, String body,
                    Priority priority, Map<String, Object> context);
}
