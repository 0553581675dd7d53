package com.overseer.core.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoped MDC keys for Overseer logging.
 * <p>
 * Each method puts its keys and returns a {@link Scope} that puts back whatever values the
 * keys had before, so scopes nest and never wipe keys set by the caller:
 * <pre>{@code
 * try (var scope = MdcContext.request(overseerId, requestId)) {
 *     ...
 * }
 * }</pre>
 */
public final class MdcContext {

    public static final String OVERSEER_ID = "overseerId";
    public static final String REQUEST_ID = "requestId";
    public static final String TARGET_ID = "targetId";

    private MdcContext() {}

    public static Scope overseer(String overseerId) {
        return put(Map.of(OVERSEER_ID, overseerId));
    }

    public static Scope request(String overseerId, String requestId) {
        return put(Map.of(OVERSEER_ID, overseerId, REQUEST_ID, requestId));
    }

    public static Scope target(String overseerId, String targetId) {
        return put(Map.of(OVERSEER_ID, overseerId, TARGET_ID, String.valueOf(targetId)));
    }

    private static Scope put(Map<String, String> values) {
        var previous = new LinkedHashMap<String, String>();
        values.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        });
        return new Scope(previous);
    }

    /**
     * Restores the MDC keys it replaced. Keys that were absent before are removed.
     */
    public static final class Scope implements AutoCloseable {

        private final Map<String, String> previous;

        private Scope(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
        }
    }
}
