package com.overseer.core.dispatch;

import com.overseer.core.model.Directive;

/**
 * Outcome of {@link DirectiveDispatcher#dispatch}.
 *
 * @param directive the dispatched directive (null on failure)
 * @param message   confirmation or failure text for the Overseer
 * @param error     failure category (null on success)
 */
public record DispatchResult(
    Directive directive,
    String message,
    DispatchError error
) {

    public static DispatchResult success(Directive directive, String confirmation) {
        return new DispatchResult(directive, confirmation, null);
    }

    public static DispatchResult failure(DispatchError error, String message) {
        return new DispatchResult(null, message, error);
    }

    public boolean dispatched() {
        return error == null;
    }
}
