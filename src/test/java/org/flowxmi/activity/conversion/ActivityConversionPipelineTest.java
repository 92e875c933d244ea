package org.flowxmi.activity.conversion;

import org.flowxmi.activity.conversion.config.ConfigHelper;
import org.flowxmi.activity.conversion.config.models.ConverterConfig;
import org.flowxmi.activity.conversion.diagnostics.Diagnostic;
import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.input.ParseInputException;
import org.flowxmi.activity.conversion.input.models.ActivityInput;
import org.flowxmi.activity.conversion.input.models.Connection;
import org.flowxmi.activity.conversion.input.models.FlowItem;
import org.flowxmi.activity.conversion.repair.MissingBranchStrategy;
import org.flowxmi.activity.conversion.repair.ReachabilityAnalyzer;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ActivityConversionPipelineTest {
    private final ActivityConversionPipeline pipeline = ActivityConversionPipeline.withDefaults();

    @Test
    void shouldConvertApprovalWithoutDiagnostics() {
        ConversionResult result = pipeline.convert(ActivityInputs.approval());
        ActivityGraph graph = result.graph();

        assertTrue(result.diagnostics().isEmpty(), () -> "Unexpected diagnostics: " + result.diagnostics());
        assertEquals(7, graph.nodeCount());
        assertEquals(2, graph.nodesOfKind(NodeKind.FINAL).size());

        FlowNode decision = graph.nodesOfKind(NodeKind.DECISION).get(0);
        List<String> guards = graph.outgoing(decision.id()).stream().map(ControlFlow::guard).sorted().toList();
        assertEquals(List.of("no", "yes"), guards);

        Set<String> reachable = ReachabilityAnalyzer.reachableFromInitial(graph);
        assertEquals(graph.nodeCount(), reachable.size());
        assertFalse(result.repair().changedGraph());
    }

    @Test
    void shouldRepairMissingYesBranchTowardsUnreachedAction() {
        ConversionResult result = pipeline.convert(ActivityInputs.paymentWithMissingBranch());
        ActivityGraph graph = result.graph();

        FlowNode decision = graph.nodesOfKind(NodeKind.DECISION).get(0);
        FlowNode confirmed = graph.nodes().stream()
                .filter(n -> "Payment confirmed".equals(n.label()))
                .findFirst()
                .orElseThrow();

        ControlFlow yes = graph.outgoing(decision.id()).stream()
                .filter(e -> "yes".equals(e.guard()))
                .findFirst()
                .orElseThrow();
        assertEquals(confirmed.id(), yes.target());

        List<Diagnostic> repaired = result.diagnostics().stream()
                .filter(d -> d.code() == DiagnosticCode.DECISION_BRANCH_REPAIRED)
                .toList();
        assertEquals(1, repaired.size());
        assertEquals(decision.id(), repaired.get(0).elementId());
        assertTrue(ReachabilityAnalyzer.unreachableNodes(graph).isEmpty());
    }

    @Test
    void shouldDropFlowLeavingFinalNode() {
        ConversionResult result = pipeline.convert(ActivityInputs.approvalWithFlowFromFinal());
        ActivityGraph graph = result.graph();

        assertTrue(result.diagnostics().stream().anyMatch(d -> d.code() == DiagnosticCode.INVALID_EDGE_REMOVED));
        for (FlowNode finalNode : graph.nodesOfKind(NodeKind.FINAL)) {
            assertTrue(graph.outgoing(finalNode.id()).isEmpty());
        }
        assertEquals(6, graph.edgeCount());
        assertStructurallySound(graph);
    }

    @Test
    void shouldUnifyIdenticalDecisions() {
        ConversionResult result = pipeline.convert(ActivityInputs.duplicatedDecision());
        ActivityGraph graph = result.graph();

        List<FlowNode> decisions = graph.nodesOfKind(NodeKind.DECISION);
        assertEquals(1, decisions.size());
        String decisionId = decisions.get(0).id();

        Set<String> targets = graph.outgoing(decisionId).stream()
                .map(e -> graph.node(e.target()).label())
                .collect(Collectors.toSet());
        assertEquals(Set.of("Approve", "Reject"), targets);
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.code() == DiagnosticCode.DUPLICATE_NODE_MERGED));

        Document doc = XmiTestSupport.parse(result.xmi());
        List<Element> decisionNodes = XmiTestSupport.modelNodes(doc, "uml:DecisionNode");
        assertEquals(1, decisionNodes.size());
        assertEquals(decisionId, decisionNodes.get(0).getAttribute("xmi:id"));
    }

    @Test
    void shouldProduceIdenticalDocumentsForIdenticalInput() {
        String first = pipeline.convert(ActivityInputs.ordersInLanes()).xmi();
        String second = pipeline.convert(ActivityInputs.ordersInLanes()).xmi();
        assertEquals(first, second);
    }

    @Test
    void shouldGiveEveryDiagramObjectItsOwnAnchor() {
        ConversionResult result = pipeline.convert(ActivityInputs.ordersInLanes());
        Document doc = XmiTestSupport.parse(result.xmi());

        Set<String> nodeIds = result.graph().nodes().stream().map(FlowNode::id).collect(Collectors.toSet());
        Set<String> anchors = new HashSet<>();
        int placed = 0;
        for (Element element : XmiTestSupport.diagramObjects(doc)) {
            if (!nodeIds.contains(element.getAttribute("subject"))) {
                continue;
            }
            placed++;
            String geometry = element.getAttribute("geometry");
            String anchor = geometry.substring(0, geometry.indexOf(";Right="));
            assertTrue(anchors.add(anchor), "Anchor used twice: " + anchor);
        }
        assertEquals(nodeIds.size(), placed);
    }

    @Test
    void shouldOnlyWriteEdgesBetweenWrittenNodes() {
        ConversionResult result = pipeline.convert(ActivityInputs.ordersInLanes());
        Document doc = XmiTestSupport.parse(result.xmi());

        Set<String> written = XmiTestSupport.elements(doc, "node").stream()
                .map(e -> e.getAttribute("xmi:id"))
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toSet());
        List<Element> edges = XmiTestSupport.modelEdges(doc);
        assertEquals(result.graph().edgeCount(), edges.size());
        for (Element edge : edges) {
            assertTrue(written.contains(edge.getAttribute("source")));
            assertTrue(written.contains(edge.getAttribute("target")));
        }
    }

    @Test
    void shouldTerminateDeadEndsAndReportUnreachableNodes() {
        ActivityInput input = ActivityInputs.approval();
        input.flow.add(new org.flowxmi.activity.conversion.input.models.FlowItem("orphan", "Action", "Archive", null));
        input.connections.removeIf(c -> c.source.equals("reject"));

        ConversionResult result = pipeline.convert(input);

        List<DiagnosticCode> codes = result.diagnostics().stream().map(Diagnostic::code).toList();
        assertTrue(codes.contains(DiagnosticCode.DEAD_END_CONNECTED));
        assertTrue(codes.contains(DiagnosticCode.UNREACHABLE_NODE));
        assertStructurallySound(result.graph());
    }

    @Test
    void shouldDrawCreatedFinalNodeInsideItsSwimlane() {
        ActivityInput input = new ActivityInput("Unfinished",
                new ArrayList<>(List.of("A")),
                new ArrayList<>(List.of(
                        new FlowItem("s", "Initial", null, "A"),
                        new FlowItem("work", "Action", "Work", "A"))),
                new ArrayList<>(List.of(new Connection("s", "work", null))));

        ConversionResult result = pipeline.convert(input);
        ActivityGraph graph = result.graph();

        List<FlowNode> finals = graph.nodesOfKind(NodeKind.FINAL);
        assertEquals(1, finals.size());
        assertEquals("A", finals.get(0).swimlane());
        List<DiagnosticCode> codes = result.diagnostics().stream().map(Diagnostic::code).toList();
        assertTrue(codes.contains(DiagnosticCode.FINAL_NODE_ADDED));
        assertFalse(codes.contains(DiagnosticCode.FALLBACK_GEOMETRY));

        Document doc = XmiTestSupport.parse(result.xmi());
        int[] lane = boxOf(doc, graph.swimlanes().iterator().next().id());
        int[] finalBox = boxOf(doc, finals.get(0).id());
        assertTrue(finalBox[0] >= lane[0] && finalBox[2] <= lane[2], "Final x outside lane");
        assertTrue(finalBox[1] >= lane[1] && finalBox[3] <= lane[3], "Final y outside lane");
        int[] work = boxOf(doc, graph.nodes().stream().filter(n -> "Work".equals(n.label())).findFirst().orElseThrow().id());
        assertTrue(finalBox[1] >= work[3], "Final should sit below its predecessor");
    }

    @Test
    void shouldUseInjectedMissingBranchStrategy() {
        ConverterConfig config = ConfigHelper.loadDefaultConfig();
        ActivityConversionPipeline withoutSuggestions =
                new ActivityConversionPipeline(config, MissingBranchStrategy.none(), null);

        ConversionResult result = withoutSuggestions.convert(ActivityInputs.paymentWithMissingBranch());

        List<DiagnosticCode> codes = result.diagnostics().stream().map(Diagnostic::code).toList();
        assertFalse(codes.contains(DiagnosticCode.DECISION_BRANCH_REPAIRED));
        assertTrue(codes.contains(DiagnosticCode.DECISION_INCOMPLETE));
        assertTrue(codes.contains(DiagnosticCode.UNREACHABLE_NODE));
    }

    @Test
    void shouldRejectInputWithoutFlow() {
        ActivityInput input = new ActivityInput("Empty", List.of(), List.of(), List.of(new Connection("a", "b", null)));
        assertThrows(ParseInputException.class, () -> pipeline.convert(input));
    }

    @Test
    void shouldConvertJsonText() {
        String json = """
                {
                  "diagramName": "Tiny",
                  "flow": [
                    {"id": "s", "kind": "start"},
                    {"id": "a", "kind": "Action", "label": "Do it"},
                    {"id": "e", "kind": "end"}
                  ],
                  "connections": [
                    {"source": "s", "target": "a"},
                    {"source": "a", "target": "e"}
                  ]
                }
                """;
        ConversionResult result = pipeline.convertJson(json);

        assertEquals("Tiny", result.graph().name());
        assertEquals(3, result.graph().nodeCount());
        assertTrue(result.xmi().contains("name=\"Do it\""));
    }

    // {left, top, right, bottom} of the diagram object for the given subject
    private static int[] boxOf(Document doc, String subject) {
        Element element = XmiTestSupport.diagramObjects(doc).stream()
                .filter(e -> subject.equals(e.getAttribute("subject")))
                .findFirst()
                .orElseThrow();
        Matcher m = Pattern.compile("Left=(-?\\d+);Top=(-?\\d+);Right=(-?\\d+);Bottom=(-?\\d+);")
                .matcher(element.getAttribute("geometry"));
        assertTrue(m.find(), element.getAttribute("geometry"));
        return new int[]{Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4))};
    }

    private static void assertStructurallySound(ActivityGraph graph) {
        for (ControlFlow edge : graph.edges()) {
            assertTrue(graph.hasNode(edge.source()));
            assertTrue(graph.hasNode(edge.target()));
            assertNotEquals(NodeKind.FINAL, graph.node(edge.source()).kind());
        }
        for (FlowNode node : graph.nodes()) {
            if (node.isControlNode() && node.kind() != NodeKind.FINAL) {
                assertFalse(graph.outgoing(node.id()).isEmpty(), () -> node + " has no outgoing flow");
            }
        }
    }
}
