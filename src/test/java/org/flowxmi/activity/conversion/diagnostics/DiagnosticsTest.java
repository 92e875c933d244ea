package org.flowxmi.activity.conversion.diagnostics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    @Test
    void shouldKeepReportOrder() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.report(DiagnosticCode.SWIMLANE_ADDED, "lane", "added");
        diagnostics.report(DiagnosticCode.ELEMENT_SKIPPED, "edge", "skipped");
        diagnostics.report(DiagnosticCode.SWIMLANE_ADDED, "other", "added again");

        assertEquals(3, diagnostics.size());
        assertEquals("edge", diagnostics.all().get(1).elementId());
        assertEquals(2, diagnostics.withCode(DiagnosticCode.SWIMLANE_ADDED).size());
        assertTrue(diagnostics.has(DiagnosticCode.ELEMENT_SKIPPED));
        assertFalse(diagnostics.has(DiagnosticCode.UNRESOLVED_OVERLAP));
    }

    @Test
    void shouldClassifySeverityByCode() {
        assertEquals(Severity.ERROR, DiagnosticCode.ELEMENT_SKIPPED.severity());
        assertEquals(Severity.WARNING, DiagnosticCode.DECISION_INCOMPLETE.severity());
        assertEquals("decision-branch-repaired", DiagnosticCode.DECISION_BRANCH_REPAIRED.code());
    }

    @Test
    void shouldRenderReadableText() {
        Diagnostic diagnostic = new Diagnostic(DiagnosticCode.UNREACHABLE_NODE, "EAID_1", "Action 'x' is unreachable");
        assertEquals("[WARNING] unreachable-node (EAID_1): Action 'x' is unreachable", diagnostic.toString());
        assertEquals("[WARNING] final-node-added: none",
                new Diagnostic(DiagnosticCode.FINAL_NODE_ADDED, null, "none").toString());
    }

    @Test
    void shouldNotAllowExternalModification() {
        Diagnostics diagnostics = new Diagnostics();
        assertTrue(diagnostics.isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> diagnostics.all().add(new Diagnostic(DiagnosticCode.SWIMLANE_ADDED, null, "x")));
    }
}
