package org.flowxmi.activity.conversion;

import org.flowxmi.activity.conversion.diagnostics.Diagnostic;
import org.flowxmi.activity.conversion.diagnostics.Severity;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.repair.RepairSummary;

import java.util.List;

/**
 * Output of one conversion: the XMI document plus everything that was reported while producing it.
 *
 * @param xmi         the serialized XMI 2.1 document
 * @param diagnostics warnings and errors in the order they were raised
 * @param graph       the repaired graph that was serialized
 * @param layout      the final layout
 * @param repair      what the repair step changed
 */
public record ConversionResult(
        String xmi,
        List<Diagnostic> diagnostics,
        ActivityGraph graph,
        DiagramLayout layout,
        RepairSummary repair
) {
    public long warningCount() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).count();
    }

    public long errorCount() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).count();
    }
}
