package org.flowxmi.activity.conversion.repair;

import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ReachabilityAnalyzer {

    /**
     * Breadth-first search from every Initial node over control flows.
     *
     * @param graph the graph
     * @return ids of all nodes reachable from some Initial node, Initial nodes included, in visiting order
     */
    public static Set<String> reachableFromInitial(ActivityGraph graph) {
        Map<String, List<String>> successors = new HashMap<>();
        for (ControlFlow edge : graph.edges()) {
            successors.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }

        Set<String> reached = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        for (FlowNode initial : graph.nodesOfKind(NodeKind.INITIAL)) {
            if (reached.add(initial.id())) {
                worklist.add(initial.id());
            }
        }
        while (!worklist.isEmpty()) {
            String node = worklist.poll();
            for (String next : successors.getOrDefault(node, List.of())) {
                if (reached.add(next)) {
                    worklist.add(next);
                }
            }
        }
        return reached;
    }

    /**
     * Control nodes that no Initial node reaches, in graph order. Notes are never reported.
     */
    public static List<FlowNode> unreachableNodes(ActivityGraph graph) {
        Set<String> reached = reachableFromInitial(graph);
        return graph.nodes().stream()
                .filter(FlowNode::isControlNode)
                .filter(n -> !reached.contains(n.id()))
                .toList();
    }
}
