package org.flowxmi.activity.conversion.repair;

import org.flowxmi.activity.conversion.graph.models.ActionNode;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FinalNode;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.InitialNode;
import org.flowxmi.activity.conversion.graph.models.NoteNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReachabilityAnalyzerTest {

    @Test
    void shouldFollowFlowsFromEveryInitialNode() {
        ActivityGraph graph = new ActivityGraph("Two starts");
        graph.addNode(new InitialNode("s1", null, null));
        graph.addNode(new InitialNode("s2", null, null));
        graph.addNode(ActionNode.builder().id("a").label("A").build());
        graph.addNode(ActionNode.builder().id("b").label("B").build());
        graph.addNode(new FinalNode("f", null, null));
        graph.addEdge(new ControlFlow("e1", "s1", "a"));
        graph.addEdge(new ControlFlow("e2", "s2", "b"));
        graph.addEdge(new ControlFlow("e3", "a", "f"));
        graph.addEdge(new ControlFlow("e4", "b", "a"));

        assertEquals(Set.of("s1", "s2", "a", "b", "f"), ReachabilityAnalyzer.reachableFromInitial(graph));
    }

    @Test
    void shouldReportUnreachableControlNodesOnly() {
        ActivityGraph graph = new ActivityGraph("Island");
        graph.addNode(new InitialNode("s", null, null));
        graph.addNode(new FinalNode("f", null, null));
        graph.addNode(ActionNode.builder().id("island").label("Island").build());
        graph.addNode(new NoteNode("n", "Remark", null, null));
        graph.addEdge(new ControlFlow("e1", "s", "f"));

        List<String> unreachable = ReachabilityAnalyzer.unreachableNodes(graph).stream().map(FlowNode::id).toList();

        assertEquals(List.of("island"), unreachable);
    }

    @Test
    void shouldHandleLongChainsWithoutRecursion() {
        ActivityGraph graph = new ActivityGraph("Long");
        graph.addNode(new InitialNode("n0", null, null));
        for (int i = 1; i <= 20_000; i++) {
            graph.addNode(ActionNode.builder().id("n" + i).label("Step " + i).build());
            graph.addEdge(new ControlFlow("e" + i, "n" + (i - 1), "n" + i));
        }

        assertEquals(20_001, ReachabilityAnalyzer.reachableFromInitial(graph).size());
    }
}
