package org.flowxmi.activity.conversion.repair;

import org.flowxmi.activity.conversion.graph.GuardLabels;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.DecisionNode;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default {@link MissingBranchStrategy}: looks for an Action that no Initial node reaches and whose
 * label reads like the missing outcome. A decision holding only a "no" branch is matched with an
 * unreached action such as "Payment confirmed", and the other way round for failure keywords.
 * Candidates in the decision's own swimlane are preferred; ties keep graph order.
 */
public class KeywordMissingBranchStrategy implements MissingBranchStrategy {
    private final BranchClassifier classifier;

    public KeywordMissingBranchStrategy(BranchClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Optional<String> suggestMissingBranchTarget(ActivityGraph graph, DecisionNode decision) {
        List<ControlFlow> outgoing = graph.outgoing(decision.id());
        boolean hasYes = outgoing.stream().anyMatch(e -> GuardLabels.YES.equals(e.guard()));
        boolean hasNo = outgoing.stream().anyMatch(e -> GuardLabels.NO.equals(e.guard()));
        if (hasYes == hasNo) {
            return Optional.empty();
        }
        String missing = hasYes ? GuardLabels.NO : GuardLabels.YES;

        Set<String> reached = ReachabilityAnalyzer.reachableFromInitial(graph);
        Set<String> existingTargets = outgoing.stream().map(ControlFlow::target).collect(Collectors.toSet());

        List<FlowNode> candidates = graph.nodesOfKind(NodeKind.ACTION).stream()
                .filter(n -> !reached.contains(n.id()))
                .filter(n -> !existingTargets.contains(n.id()))
                .filter(n -> missing.equals(classifier.classify(n.label())))
                .toList();

        return candidates.stream()
                .min(Comparator.comparingInt(n -> Objects.equals(n.swimlane(), decision.swimlane()) ? 0 : 1))
                .map(FlowNode::id);
    }
}
