package org.flowxmi.activity.conversion.repair;

import org.flowxmi.activity.conversion.graph.models.ActionNode;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.DecisionNode;
import org.flowxmi.activity.conversion.graph.models.FinalNode;
import org.flowxmi.activity.conversion.graph.models.InitialNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class KeywordMissingBranchStrategyTest {
    private final KeywordMissingBranchStrategy strategy = new KeywordMissingBranchStrategy(
            new BranchClassifier(List.of("confirm", "approve"), List.of("reject", "cancel")));

    @Test
    void shouldSuggestUnreachedSuccessActionForMissingYes() {
        ActivityGraph graph = graphWithDecision("no");
        graph.addNode(action("confirmed", "Payment confirmed", null));

        Optional<String> target = strategy.suggestMissingBranchTarget(graph, decision(graph));

        assertEquals(Optional.of("confirmed"), target);
    }

    @Test
    void shouldSuggestFailureActionForMissingNo() {
        ActivityGraph graph = graphWithDecision("yes");
        graph.addNode(action("confirmed", "Payment confirmed", null));
        graph.addNode(action("cancelled", "Cancel order", null));

        assertEquals(Optional.of("cancelled"), strategy.suggestMissingBranchTarget(graph, decision(graph)));
    }

    @Test
    void shouldPreferCandidateInDecisionLane() {
        ActivityGraph graph = graphWithDecision("no");
        graph.addNode(action("other", "Confirm elsewhere", "Finance"));
        graph.addNode(action("local", "Confirm here", "Sales"));

        assertEquals(Optional.of("local"), strategy.suggestMissingBranchTarget(graph, decision(graph)));
    }

    @Test
    void shouldIgnoreReachedActions() {
        ActivityGraph graph = graphWithDecision("no");
        graph.addNode(action("approved", "Approve", null));
        graph.addEdge(new ControlFlow("e-reach", "s", "approved"));

        assertTrue(strategy.suggestMissingBranchTarget(graph, decision(graph)).isEmpty());
    }

    @Test
    void shouldNotSuggestForCompleteDecision() {
        ActivityGraph graph = graphWithDecision("no");
        graph.addNode(action("confirmed", "Payment confirmed", null));
        graph.addNode(action("x", "Other", null));
        graph.addEdge(new ControlFlow("e-yes", "d", "x", "yes", false));

        assertTrue(strategy.suggestMissingBranchTarget(graph, decision(graph)).isEmpty());
    }

    // s -> d -(guard)-> r -> f, decision in lane Sales
    private static ActivityGraph graphWithDecision(String guard) {
        ActivityGraph graph = new ActivityGraph("Decision");
        graph.addNode(new InitialNode("s", null, "Sales"));
        graph.addNode(new DecisionNode("d", "Paid?", "Sales"));
        graph.addNode(action("r", "Send reminder", "Sales"));
        graph.addNode(new FinalNode("f", null, "Sales"));
        graph.addEdge(new ControlFlow("e1", "s", "d"));
        graph.addEdge(new ControlFlow("e2", "d", "r", guard, false));
        graph.addEdge(new ControlFlow("e3", "r", "f"));
        return graph;
    }

    private static DecisionNode decision(ActivityGraph graph) {
        return (DecisionNode) graph.node("d");
    }

    private static ActionNode action(String id, String label, String lane) {
        return ActionNode.builder().id(id).label(label).swimlane(lane).build();
    }
}
