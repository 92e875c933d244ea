package org.flowxmi.activity.conversion.diagnostics;

/**
 * A single reported finding of a conversion.
 *
 * @param code      what happened
 * @param elementId the node, edge or swimlane concerned (may be null for graph-wide findings)
 * @param message   human-readable detail
 */
public record Diagnostic(
        DiagnosticCode code,
        String elementId,
        String message
) {
    public Severity severity() {
        return code.severity();
    }

    @Override
    public String toString() {
        return "[" + severity() + "] " + code.code()
                + (elementId != null ? " (" + elementId + ")" : "")
                + ": " + message;
    }
}
