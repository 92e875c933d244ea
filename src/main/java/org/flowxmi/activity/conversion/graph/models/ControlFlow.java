package org.flowxmi.activity.conversion.graph.models;

/**
 * A directed control-flow edge between two nodes.
 *
 * @param id              unique edge id
 * @param source          id of the source node
 * @param target          id of the target node
 * @param guard           normalized guard label (e.g. "yes", "no"), null when unguarded
 * @param crossesSwimlane true when source and target sit in different swimlanes
 */
public record ControlFlow(
        String id,
        String source,
        String target,
        String guard,
        boolean crossesSwimlane
) {
    // Constructor for unguarded flows
    public ControlFlow(String id, String source, String target) {
        this(id, source, target, null, false);
    }

    public boolean hasGuard() {
        return guard != null && !guard.isBlank();
    }

    public ControlFlow withGuard(String newGuard) {
        return new ControlFlow(id, source, target, newGuard, crossesSwimlane);
    }

    public ControlFlow withCrossesSwimlane(boolean crosses) {
        return new ControlFlow(id, source, target, guard, crosses);
    }

    public ControlFlow withEndpoints(String newSource, String newTarget) {
        return new ControlFlow(id, newSource, newTarget, guard, crossesSwimlane);
    }
}
