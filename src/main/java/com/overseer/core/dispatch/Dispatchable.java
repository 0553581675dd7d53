package com.overseer.core.dispatch;

import com.overseer.core.model.Directive;

/**
 * Capability of a registered target that accepts directives directly.
 */
public interface Dispatchable {

    /**
     * @param directive          the directive to carry out
     * @param executeImmediately whether the receiver should start work right away
     */
    void receiveDirective(Directive directive, boolean executeImmediately);
}
