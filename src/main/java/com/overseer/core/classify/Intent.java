package com.overseer.core.classify;

import com.overseer.core.model.Decision;

/**
 * Result of classifying Overseer input.
 *
 * @param type     the routing category
 * @param target   addressed target name ({@link IntentType#DIRECTIVE} only)
 * @param body     trimmed instruction text ({@link IntentType#DIRECTIVE} only)
 * @param decision approve or reject ({@link IntentType#DECISION} only)
 * @param ref      request reference, empty when none was given ({@link IntentType#DECISION} only)
 * @param text     the raw input
 */
public record Intent(
    IntentType type,
    String target,
    String body,
    Decision decision,
    String ref,
    String text
) {

    public static Intent directive(String target, String body, String text) {
        return new Intent(IntentType.DIRECTIVE, target, body, null, "", text);
    }

    public static Intent decision(Decision decision, String ref, String text) {
        return new Intent(IntentType.DECISION, null, null, decision, ref == null ? "" : ref, text);
    }

    public static Intent query(String text) {
        return new Intent(IntentType.QUERY, null, null, null, "", text);
    }

    public static Intent general(String text) {
        return new Intent(IntentType.GENERAL, null, null, null, "", text);
    }

    public boolean hasRef() {
        return ref != null && !ref.isEmpty();
    }
}
