package org.flowxmi.activity.conversion.graph.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Directed graph of one activity diagram. Nodes, edges and swimlanes keep their
 * insertion order so that every traversal over the graph is deterministic.
 */
public class ActivityGraph {
    private final String name;
    private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
    private final Map<String, ControlFlow> edges = new LinkedHashMap<>();
    private final Map<String, Swimlane> swimlanes = new LinkedHashMap<>();

    public ActivityGraph(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    // ------ nodes

    public void addNode(FlowNode node) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.id())) {
            throw new IllegalStateException("Node '" + node.id() + "' already exists in graph '" + name + "'.");
        }
        nodes.put(node.id(), node);
    }

    /** Replaces a node with an updated copy carrying the same id. */
    public void replaceNode(FlowNode node) {
        if (!nodes.containsKey(node.id())) {
            throw new IllegalStateException("Cannot replace unknown node '" + node.id() + "'.");
        }
        nodes.put(node.id(), node);
    }

    public FlowNode node(String id) {
        return nodes.get(id);
    }

    public boolean hasNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public Collection<FlowNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<FlowNode> nodesOfKind(NodeKind kind) {
        return nodes.values().stream()
                .filter(n -> n.kind() == kind)
                .toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    // ------ edges

    public void addEdge(ControlFlow edge) {
        Objects.requireNonNull(edge, "edge");
        if (edges.containsKey(edge.id())) {
            throw new IllegalStateException("Edge '" + edge.id() + "' already exists in graph '" + name + "'.");
        }
        edges.put(edge.id(), edge);
    }

    public void replaceEdge(ControlFlow edge) {
        if (!edges.containsKey(edge.id())) {
            throw new IllegalStateException("Cannot replace unknown edge '" + edge.id() + "'.");
        }
        edges.put(edge.id(), edge);
    }

    public boolean removeEdge(String edgeId) {
        return edges.remove(edgeId) != null;
    }

    public ControlFlow edge(String id) {
        return edges.get(id);
    }

    public Collection<ControlFlow> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    /** Snapshot copy, safe to iterate while the graph is being modified. */
    public List<ControlFlow> edgeSnapshot() {
        return new ArrayList<>(edges.values());
    }

    public List<ControlFlow> outgoing(String nodeId) {
        return edges.values().stream()
                .filter(e -> e.source().equals(nodeId))
                .toList();
    }

    public List<ControlFlow> incoming(String nodeId) {
        return edges.values().stream()
                .filter(e -> e.target().equals(nodeId))
                .toList();
    }

    public int edgeCount() {
        return edges.size();
    }

    // ------ swimlanes

    public void addSwimlane(Swimlane swimlane) {
        if (swimlanes.containsKey(swimlane.name())) {
            throw new IllegalStateException("Swimlane '" + swimlane.name() + "' already exists in graph '" + name + "'.");
        }
        swimlanes.put(swimlane.name(), swimlane);
    }

    public Swimlane swimlane(String laneName) {
        return laneName == null ? null : swimlanes.get(laneName);
    }

    public boolean hasSwimlane(String laneName) {
        return laneName != null && swimlanes.containsKey(laneName);
    }

    public Collection<Swimlane> swimlanes() {
        return Collections.unmodifiableCollection(swimlanes.values());
    }

    /** Nodes of the given lane, in graph order. A null lane selects nodes outside any lane. */
    public List<FlowNode> nodesInSwimlane(String laneName) {
        return nodes.values().stream()
                .filter(n -> Objects.equals(n.swimlane(), laneName))
                .toList();
    }
}
