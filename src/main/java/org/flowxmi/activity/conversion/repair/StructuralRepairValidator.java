package org.flowxmi.activity.conversion.repair;

import org.flowxmi.activity.conversion.ConversionContext;
import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.diagnostics.Diagnostics;
import org.flowxmi.activity.conversion.graph.GuardLabels;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.DecisionNode;
import org.flowxmi.activity.conversion.graph.models.FinalNode;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Brings a laid-out graph into a serializable shape and reports what it could not fix.
 * <p>
 * Steps, in order:
 * <ol>
 *     <li>drop invalid edges: leaving a Final node, self-loops, touching a note, dangling</li>
 *     <li>drop duplicate edges and repeated guards on the same decision</li>
 *     <li>connect dead ends to the nearest Final node, creating one if the graph has none</li>
 *     <li>infer yes/no guards on unguarded decision branches</li>
 *     <li>complete one-sided decisions through the {@link MissingBranchStrategy}</li>
 *     <li>recompute swimlane crossing and report unreachable nodes</li>
 * </ol>
 * Nodes are never removed. Running the repair a second time leaves the graph unchanged.
 */
public class StructuralRepairValidator {
    private static final Logger log = LoggerFactory.getLogger(StructuralRepairValidator.class);

    private final MissingBranchStrategy missingBranchStrategy;
    private final BranchClassifier classifier;

    public StructuralRepairValidator(MissingBranchStrategy missingBranchStrategy, BranchClassifier classifier) {
        this.missingBranchStrategy = missingBranchStrategy;
        this.classifier = classifier;
    }

    /**
     * Repairs the graph in place.
     *
     * @param graph   the graph to repair
     * @param layout  the current layout, used to pick the nearest Final node; may be null
     * @param context the conversion context
     * @return what was changed
     */
    public RepairSummary repair(ActivityGraph graph, DiagramLayout layout, ConversionContext context) {
        Diagnostics diagnostics = context.diagnostics();

        int removed = removeInvalidEdges(graph, diagnostics);
        removed += removeDuplicateEdges(graph, diagnostics);

        int[] deadEndChanges = connectDeadEnds(graph, layout, context);
        int inferred = inferDecisionGuards(graph, diagnostics);
        int completed = completeDecisions(graph, context);

        refreshSwimlaneCrossing(graph);

        for (FlowNode node : ReachabilityAnalyzer.unreachableNodes(graph)) {
            diagnostics.report(DiagnosticCode.UNREACHABLE_NODE, node.id(),
                    describe(node) + " cannot be reached from any Initial node");
        }

        RepairSummary summary = new RepairSummary(removed, deadEndChanges[0] + completed, deadEndChanges[1], inferred);
        log.info("Repaired '{}': {}", graph.name(), summary);
        return summary;
    }

    private int removeInvalidEdges(ActivityGraph graph, Diagnostics diagnostics) {
        int removed = 0;
        for (ControlFlow edge : graph.edgeSnapshot()) {
            FlowNode source = graph.node(edge.source());
            FlowNode target = graph.node(edge.target());
            String reason = null;
            if (source == null || target == null) {
                reason = "references a missing node";
            } else if (source.kind() == NodeKind.FINAL) {
                reason = "leaves Final node " + describe(source);
            } else if (edge.source().equals(edge.target())) {
                reason = "is a self-loop on " + describe(source);
            } else if (!source.isControlNode() || !target.isControlNode()) {
                reason = "connects a note";
            }
            if (reason != null) {
                graph.removeEdge(edge.id());
                removed++;
                diagnostics.report(DiagnosticCode.INVALID_EDGE_REMOVED, edge.id(), "Control flow " + reason);
            }
        }
        return removed;
    }

    private int removeDuplicateEdges(ActivityGraph graph, Diagnostics diagnostics) {
        int removed = 0;
        Set<String> seenEdges = new HashSet<>();
        Set<String> seenDecisionGuards = new HashSet<>();
        for (ControlFlow edge : graph.edgeSnapshot()) {
            String guard = edge.hasGuard() ? edge.guard() : "";
            if (!seenEdges.add(edge.source() + "|" + edge.target() + "|" + guard)) {
                graph.removeEdge(edge.id());
                removed++;
                diagnostics.report(DiagnosticCode.DUPLICATE_EDGE_REMOVED, edge.id(),
                        "Duplicate control flow " + edge.source() + " -> " + edge.target() + " removed");
                continue;
            }
            if (edge.hasGuard() && graph.node(edge.source()).kind() == NodeKind.DECISION
                    && !seenDecisionGuards.add(edge.source() + "|" + guard)) {
                graph.removeEdge(edge.id());
                removed++;
                diagnostics.report(DiagnosticCode.DUPLICATE_EDGE_REMOVED, edge.id(),
                        "Decision " + describe(graph.node(edge.source())) + " already has a '" + guard + "' branch");
            }
        }
        return removed;
    }

    // returns {edges added, nodes added}
    private int[] connectDeadEnds(ActivityGraph graph, DiagramLayout layout, ConversionContext context) {
        List<FlowNode> deadEnds = graph.nodes().stream()
                .filter(FlowNode::isControlNode)
                .filter(n -> n.kind() != NodeKind.FINAL)
                .filter(n -> graph.outgoing(n.id()).isEmpty())
                .toList();
        if (deadEnds.isEmpty()) {
            return new int[]{0, 0};
        }

        int addedNodes = 0;
        List<FlowNode> finals = new ArrayList<>(graph.nodesOfKind(NodeKind.FINAL));
        if (finals.isEmpty()) {
            FinalNode created = new FinalNode(context.ids().nextElementId(), null, deadEnds.get(0).swimlane());
            graph.addNode(created);
            finals.add(created);
            addedNodes++;
            context.diagnostics().report(DiagnosticCode.FINAL_NODE_ADDED, created.id(),
                    "Graph had no Final node; one was added to terminate dead ends");
        }

        for (FlowNode deadEnd : deadEnds) {
            FlowNode target = nearestFinal(deadEnd, finals, layout);
            graph.addEdge(new ControlFlow(context.ids().nextElementId(), deadEnd.id(), target.id(), null,
                    !Objects.equals(deadEnd.swimlane(), target.swimlane())));
            context.diagnostics().report(DiagnosticCode.DEAD_END_CONNECTED, deadEnd.id(),
                    describe(deadEnd) + " had no outgoing flow and was connected to " + describe(target));
        }
        return new int[]{deadEnds.size(), addedNodes};
    }

    private static FlowNode nearestFinal(FlowNode from, List<FlowNode> finals, DiagramLayout layout) {
        FlowNode best = null;
        int bestLane = Integer.MAX_VALUE;
        long bestDistance = Long.MAX_VALUE;
        for (FlowNode candidate : finals) {
            int lane = Objects.equals(from.swimlane(), candidate.swimlane()) ? 0 : 1;
            long distance = distance(layout, from.id(), candidate.id());
            if (lane < bestLane || (lane == bestLane && distance < bestDistance)) {
                best = candidate;
                bestLane = lane;
                bestDistance = distance;
            }
        }
        return best;
    }

    private static long distance(DiagramLayout layout, String a, String b) {
        NodeGeometry ga = layout == null ? null : layout.geometry(a);
        NodeGeometry gb = layout == null ? null : layout.geometry(b);
        if (ga == null || gb == null) {
            return Long.MAX_VALUE - 1;
        }
        long dx = ga.centerX() - gb.centerX();
        long dy = ga.centerY() - gb.centerY();
        return dx * dx + dy * dy;
    }

    private int inferDecisionGuards(ActivityGraph graph, Diagnostics diagnostics) {
        int inferred = 0;
        for (FlowNode decision : graph.nodesOfKind(NodeKind.DECISION)) {
            List<ControlFlow> outgoing = graph.outgoing(decision.id());
            Set<String> used = new HashSet<>();
            for (ControlFlow edge : outgoing) {
                if (edge.hasGuard()) {
                    used.add(edge.guard());
                }
            }
            for (ControlFlow edge : outgoing) {
                if (edge.hasGuard()) {
                    continue;
                }
                String guess = classifier.classify(graph.node(edge.target()).label());
                String guard = guess != null && !used.contains(guess) ? guess
                        : !used.contains(GuardLabels.YES) ? GuardLabels.YES
                        : !used.contains(GuardLabels.NO) ? GuardLabels.NO
                        : null;
                if (guard == null) {
                    // both canonical guards taken, leave as the default branch
                    continue;
                }
                used.add(guard);
                graph.replaceEdge(edge.withGuard(guard));
                inferred++;
                diagnostics.report(DiagnosticCode.DECISION_GUARD_INFERRED, edge.id(),
                        "Branch of " + describe(decision) + " to " + describe(graph.node(edge.target()))
                                + " was given guard '" + guard + "'");
            }
        }
        return inferred;
    }

    private int completeDecisions(ActivityGraph graph, ConversionContext context) {
        int added = 0;
        for (FlowNode node : graph.nodesOfKind(NodeKind.DECISION)) {
            DecisionNode decision = (DecisionNode) node;
            List<ControlFlow> outgoing = graph.outgoing(decision.id());
            boolean hasYes = outgoing.stream().anyMatch(e -> GuardLabels.YES.equals(e.guard()));
            boolean hasNo = outgoing.stream().anyMatch(e -> GuardLabels.NO.equals(e.guard()));
            long distinctGuards = outgoing.stream().filter(ControlFlow::hasGuard).map(ControlFlow::guard).distinct().count();

            if (hasYes && hasNo) {
                continue;
            }
            if (hasYes || hasNo) {
                String missing = hasYes ? GuardLabels.NO : GuardLabels.YES;
                Optional<String> target = missingBranchStrategy.suggestMissingBranchTarget(graph, decision)
                        .filter(id -> graph.hasNode(id) && !id.equals(decision.id()))
                        .filter(id -> graph.node(id).isControlNode());
                if (target.isPresent()) {
                    FlowNode targetNode = graph.node(target.get());
                    ControlFlow edge = new ControlFlow(context.ids().nextElementId(), decision.id(), targetNode.id(),
                            missing, !Objects.equals(decision.swimlane(), targetNode.swimlane()));
                    graph.addEdge(edge);
                    added++;
                    context.diagnostics().report(DiagnosticCode.DECISION_BRANCH_REPAIRED, decision.id(),
                            "Missing '" + missing + "' branch of " + describe(decision) + " now leads to " + describe(targetNode));
                    continue;
                }
                context.diagnostics().report(DiagnosticCode.DECISION_INCOMPLETE, decision.id(),
                        describe(decision) + " has no '" + missing + "' branch");
            } else if (distinctGuards < 2) {
                context.diagnostics().report(DiagnosticCode.DECISION_INCOMPLETE, decision.id(),
                        describe(decision) + " has fewer than two guarded branches");
            }
        }
        return added;
    }

    private static void refreshSwimlaneCrossing(ActivityGraph graph) {
        for (ControlFlow edge : graph.edgeSnapshot()) {
            boolean crosses = !Objects.equals(graph.node(edge.source()).swimlane(), graph.node(edge.target()).swimlane());
            if (crosses != edge.crossesSwimlane()) {
                graph.replaceEdge(edge.withCrossesSwimlane(crosses));
            }
        }
    }

    private static String describe(FlowNode node) {
        return node.hasLabel()
                ? node.kind().displayName() + " '" + node.label() + "'"
                : node.kind().displayName() + " " + node.id();
    }
}
