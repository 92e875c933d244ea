package org.flowxmi.activity.conversion.graph.models;

import java.util.Locale;
import java.util.Optional;

/**
 * The eight node kinds of an activity diagram.
 */
public enum NodeKind {
    INITIAL("Initial"),
    FINAL("Final"),
    ACTION("Action"),
    DECISION("Decision"),
    MERGE("Merge"),
    FORK("Fork"),
    JOIN("Join"),
    NOTE("Note");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a kind from its input spelling. Accepts the display names case-insensitively
     * plus the aliases produced by common activity parsers ("start", "end", "stop",
     * "activity", "comment").
     *
     * @param value the raw kind as written in the input
     * @return the kind, or empty if the value is not recognised
     */
    public static Optional<NodeKind> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "initial", "start" -> Optional.of(INITIAL);
            case "final", "end", "stop" -> Optional.of(FINAL);
            case "action", "activity" -> Optional.of(ACTION);
            case "decision" -> Optional.of(DECISION);
            case "merge" -> Optional.of(MERGE);
            case "fork" -> Optional.of(FORK);
            case "join" -> Optional.of(JOIN);
            case "note", "comment" -> Optional.of(NOTE);
            default -> Optional.empty();
        };
    }
}
