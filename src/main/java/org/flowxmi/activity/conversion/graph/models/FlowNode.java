package org.flowxmi.activity.conversion.graph.models;

/**
 * A node of an activity graph. The set of implementations is closed; every
 * switch over {@link #kind()} therefore covers all node types.
 */
public sealed interface FlowNode
        permits InitialNode, FinalNode, ActionNode, DecisionNode, MergeNode, ForkNode, JoinNode, NoteNode {

    String id();

    NodeKind kind();

    String label();

    /** Name of the owning swimlane, or null when the node sits outside any lane. */
    String swimlane();

    default boolean hasLabel() {
        return label() != null && !label().isBlank();
    }

    default int labelLength() {
        return label() == null ? 0 : label().trim().length();
    }

    /** Notes annotate other nodes and never carry control flow. */
    default boolean isControlNode() {
        return kind() != NodeKind.NOTE;
    }

    /**
     * Creates a node of the given kind. Kind-specific attributes that do not apply are ignored.
     */
    static FlowNode of(NodeKind kind, String id, String label, String swimlane,
                       String color, String extraActionTag, String annotatedNodeId) {
        return switch (kind) {
            case INITIAL -> new InitialNode(id, label, swimlane);
            case FINAL -> new FinalNode(id, label, swimlane);
            case ACTION -> ActionNode.builder()
                    .id(id)
                    .label(label)
                    .swimlane(swimlane)
                    .color(color)
                    .extraActionTag(extraActionTag)
                    .build();
            case DECISION -> new DecisionNode(id, label, swimlane);
            case MERGE -> new MergeNode(id, label, swimlane);
            case FORK -> new ForkNode(id, label, swimlane);
            case JOIN -> new JoinNode(id, label, swimlane);
            case NOTE -> new NoteNode(id, label, swimlane, annotatedNodeId);
        };
    }
}
