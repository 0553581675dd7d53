package com.overseer.core.classify;

import com.overseer.core.model.Decision;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic pattern classifier that turns Overseer input into an {@link Intent}.
 * <p>
 * Rules are evaluated in priority order and the first match wins:
 * <ol>
 *   <li>{@code @target: instruction} (or {@code @target instruction}), body may span lines</li>
 *   <li>an accept token such as "approve" or "yes", optionally followed by {@code #ref}</li>
 *   <li>a reject token such as "reject" or "no", optionally followed by {@code #ref}</li>
 *   <li>a status keyword anywhere in the text, or a trailing question mark</li>
 *   <li>everything else is general</li>
 * </ol>
 * The classifier has no state and never throws.
 */
public class IntentClassifier {

    private static final Pattern DIRECTIVE_PATTERN =
            Pattern.compile("^@([\\w-]+)[:\\s]+(.+)$",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);

    private static final String REF_SUFFIX = "\\b\\s*(?:#?([A-Za-z0-9-]+))?";

    private static final Pattern APPROVE_PATTERN = Pattern.compile(
            "^(approve|approved|accept|akkoord|goedkeuren|ja|yes|ok|okay)" + REF_SUFFIX,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern REJECT_PATTERN = Pattern.compile(
            "^(reject|rejected|deny|decline|afwijzen|weigeren|nee|no)" + REF_SUFFIX,
            Pattern.CASE_INSENSITIVE);

    private static final List<String> STATUS_KEYWORDS = List.of(
            "status", "progress", "update", "report", "rapport", "voortgang", "hoe gaat", "how is", "how are");

    public Intent classify(String text) {
        if (text == null || text.isBlank()) {
            return Intent.general(text == null ? "" : text);
        }

        Matcher directive = DIRECTIVE_PATTERN.matcher(text);
        if (directive.matches()) {
            String body = directive.group(2).strip();
            if (!body.isEmpty()) {
                return Intent.directive(directive.group(1), body, text);
            }
        }

        String trimmed = text.strip();

        Matcher approve = APPROVE_PATTERN.matcher(trimmed);
        if (approve.lookingAt()) {
            return Intent.decision(Decision.APPROVE, approve.group(2), text);
        }

        Matcher reject = REJECT_PATTERN.matcher(trimmed);
        if (reject.lookingAt()) {
            return Intent.decision(Decision.REJECT, reject.group(2), text);
        }

        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : STATUS_KEYWORDS) {
            if (lower.contains(keyword)) {
                return Intent.query(text);
            }
        }
        if (trimmed.endsWith("?")) {
            return Intent.query(text);
        }

        return Intent.general(text);
    }
}
