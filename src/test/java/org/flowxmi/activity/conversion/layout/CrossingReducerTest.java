package org.flowxmi.activity.conversion.layout;

import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.InitialNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrossingReducerTest {

    @Test
    void shouldUncrossParallelChains() {
        ActivityGraph graph = new ActivityGraph("Chains");
        graph.addNode(new InitialNode("s1", null, null));
        graph.addNode(new InitialNode("s2", null, null));
        graph.addNode(LayoutTestGraphs.action("b", "Second", null));
        graph.addNode(LayoutTestGraphs.action("a", "First", null));
        graph.addEdge(new ControlFlow("e1", "s1", "a"));
        graph.addEdge(new ControlFlow("e2", "s2", "b"));
        List<List<String>> layers = new ArrayList<>();
        layers.add(new ArrayList<>(List.of("s1", "s2")));
        layers.add(new ArrayList<>(List.of("b", "a")));

        CrossingReducer.reduce(graph, layers, 1);

        assertEquals(List.of("s1", "s2"), layers.get(0));
        assertEquals(List.of("a", "b"), layers.get(1));
    }

    @Test
    void shouldLeaveLayersAloneWithoutSweeps() {
        ActivityGraph graph = LayoutTestGraphs.branching();
        List<List<String>> layers = new ArrayList<>();
        layers.add(new ArrayList<>(List.of("ko", "ok")));
        layers.add(new ArrayList<>(List.of("f1", "f2")));

        CrossingReducer.reduce(graph, layers, 0);

        assertEquals(List.of("ko", "ok"), layers.get(0));
    }
}
