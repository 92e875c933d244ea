package org.flowxmi.activity.conversion.graph;

import java.util.Locale;
import java.util.Set;

/**
 * Normalizes raw guard text into the canonical branch labels.
 */
public class GuardLabels {
    public static final String YES = "yes";
    public static final String NO = "no";

    private static final Set<String> YES_WORDS = Set.of("yes", "y", "true", "tak");
    private static final Set<String> NO_WORDS = Set.of("no", "n", "false", "nie");

    /**
     * Strips brackets and maps the usual affirmative and negative spellings
     * (including Polish "tak"/"nie" and "x is true"/"x is false") onto {@link #YES} and {@link #NO}.
     * Any other text is returned trimmed and unbracketed.
     *
     * @param raw the guard as written in the input, may be null
     * @return the normalized guard, or null when there is no guard text
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String guard = stripBrackets(raw.trim());
        if (guard.isEmpty()) {
            return null;
        }

        String lower = guard.toLowerCase(Locale.ROOT);
        if (lower.endsWith("?")) {
            lower = lower.substring(0, lower.length() - 1).trim();
        }
        if (YES_WORDS.contains(lower) || lower.endsWith(" is true")) {
            return YES;
        }
        if (NO_WORDS.contains(lower) || lower.endsWith(" is false")) {
            return NO;
        }
        return guard;
    }

    private static String stripBrackets(String value) {
        String result = value;
        // nested "[(yes)]" style wrappers
        while (result.length() >= 2
                && ((result.startsWith("[") && result.endsWith("]"))
                || (result.startsWith("(") && result.endsWith(")")))) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }
}
