package org.flowxmi.activity.conversion.repair;

import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.DecisionNode;

import java.util.Optional;

/**
 * Picks the target of a decision's missing yes/no branch.
 * Implementations must be deterministic: the same graph must always yield the same answer.
 */
@FunctionalInterface
public interface MissingBranchStrategy {

    /**
     * @param graph    the graph being repaired
     * @param decision a decision that carries only one of the two canonical guards
     * @return the id of the node the missing branch should lead to, or empty to leave the decision incomplete
     */
    Optional<String> suggestMissingBranchTarget(ActivityGraph graph, DecisionNode decision);

    /** A strategy that never suggests anything; incomplete decisions are only reported. */
    static MissingBranchStrategy none() {
        return (graph, decision) -> Optional.empty();
    }
}
