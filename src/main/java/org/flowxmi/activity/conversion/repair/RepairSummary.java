package org.flowxmi.activity.conversion.repair;

/**
 * Counts of the changes one repair run made to the graph. All zero means the graph was already sound.
 */
public record RepairSummary(
        int removedEdges,
        int addedEdges,
        int addedNodes,
        int inferredGuards
) {
    public boolean changedGraph() {
        return removedEdges + addedEdges + addedNodes + inferredGuards > 0;
    }
}
