package org.flowxmi.activity.conversion.graph.models;

/**
 * Represents a swimlane (activity partition).
 *
 * @param id   the unique identifier of the swimlane
 * @param name the display name, also used by nodes to reference their lane
 */
public record Swimlane(
        String id,
        String name
) {
}
