package org.flowxmi.activity.conversion.graph.models;

import lombok.Builder;

/**
 * An executable step of the activity.
 *
 * @param id             unique node id
 * @param label          the action text
 * @param swimlane       owning swimlane name, may be null
 * @param color          optional color tag (e.g. "green", "#FF0000"); drives the fill color in the diagram
 * @param extraActionTag optional free-form tag carried through to the element notes
 */
@Builder
public record ActionNode(
        String id,
        String label,
        String swimlane,
        String color,
        String extraActionTag
) implements FlowNode {
    @Override
    public NodeKind kind() {
        return NodeKind.ACTION;
    }

    public ActionNodeBuilder toBuilder() {
        return ActionNode.builder()
                .id(this.id)
                .label(this.label)
                .swimlane(this.swimlane)
                .color(this.color)
                .extraActionTag(this.extraActionTag);
    }
}
