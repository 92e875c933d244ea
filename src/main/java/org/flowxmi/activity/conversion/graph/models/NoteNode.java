package org.flowxmi.activity.conversion.graph.models;

/**
 * A free-text annotation. Serialized as a UML comment attached to {@code annotatedNodeId}.
 */
public record NoteNode(
        String id,
        String label,
        String swimlane,
        String annotatedNodeId  // null for a floating note
) implements FlowNode {
    @Override
    public NodeKind kind() {
        return NodeKind.NOTE;
    }

    public NoteNode withAnnotatedNodeId(String nodeId) {
        return new NoteNode(id, label, swimlane, nodeId);
    }
}
