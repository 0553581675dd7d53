package com.overseer.core.dispatch;

/**
 * Why a directive could not be dispatched.
 */
public enum DispatchError {
    /** No target with the given id or name. */
    NOT_FOUND,
    /** No directive manager configured and the target cannot receive directives. */
    NO_DISPATCH_PATH,
    /** The manager or target threw while handling the directive. */
    DELEGATE_FAILURE,
    /** The manager or target did not return within the dispatch deadline. */
    TIMEOUT
}
