package org.flowxmi.activity.conversion.graph.models;

public record FinalNode(
        String id,
        String label,
        String swimlane
) implements FlowNode {
    @Override
    public NodeKind kind() {
        return NodeKind.FINAL;
    }
}
