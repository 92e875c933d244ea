package org.flowxmi.activity.conversion.graph.models;

public record InitialNode(
        String id,
        String label,
        String swimlane
) implements FlowNode {
    @Override
    public NodeKind kind() {
        return NodeKind.INITIAL;
    }
}
