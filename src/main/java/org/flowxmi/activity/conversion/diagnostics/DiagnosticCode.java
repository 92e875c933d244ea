package org.flowxmi.activity.conversion.diagnostics;

/**
 * Machine-readable codes for everything a conversion reports without failing.
 * The {@link #code()} value is the stable kebab-case identifier used in reports.
 */
public enum DiagnosticCode {
    // graph building
    DUPLICATE_NODE_MERGED("duplicate-node-merged", Severity.WARNING),
    DANGLING_CONNECTION_DROPPED("dangling-connection-dropped", Severity.WARNING),
    SWIMLANE_ADDED("swimlane-added", Severity.WARNING),

    // layout
    ORPHAN_LAYER_NODE("orphan-layer-node", Severity.WARNING),
    UNRESOLVED_OVERLAP("unresolved-overlap", Severity.WARNING),

    // repair
    INVALID_EDGE_REMOVED("invalid-edge-removed", Severity.WARNING),
    DUPLICATE_EDGE_REMOVED("duplicate-edge-removed", Severity.WARNING),
    DEAD_END_CONNECTED("dead-end-connected", Severity.WARNING),
    FINAL_NODE_ADDED("final-node-added", Severity.WARNING),
    DECISION_GUARD_INFERRED("decision-guard-inferred", Severity.WARNING),
    DECISION_BRANCH_REPAIRED("decision-branch-repaired", Severity.WARNING),
    DECISION_INCOMPLETE("decision-incomplete", Severity.WARNING),
    UNREACHABLE_NODE("unreachable-node", Severity.WARNING),

    // serialization
    FALLBACK_GEOMETRY("fallback-geometry", Severity.WARNING),
    ELEMENT_SKIPPED("element-skipped", Severity.ERROR);

    private final String code;
    private final Severity severity;

    DiagnosticCode(String code, Severity severity) {
        this.code = code;
        this.severity = severity;
    }

    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }
}
