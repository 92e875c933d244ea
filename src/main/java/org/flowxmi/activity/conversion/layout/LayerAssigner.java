package org.flowxmi.activity.conversion.layout;

import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.diagnostics.Diagnostics;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.graph.models.NoteNode;
import org.flowxmi.activity.conversion.layout.models.LayoutSettings;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assigns every node to a horizontal layer (longest-path leveling).
 * <p>
 * Roots are Initial nodes and nodes without incoming edges. Edges closing a cycle (back edges,
 * found by an iterative depth-first search from the roots) are ignored for leveling. Nodes the
 * roots never reach end up in a trailing orphan layer. Notes share the layer of the node they
 * annotate.
 */
public class LayerAssigner {

    /**
     * Layer structure produced by {@link #assign}.
     *
     * @param layers  node ids per regular layer, top to bottom
     * @param orphans node ids of the trailing orphan layer, empty when every node was leveled
     */
    public record Layering(List<List<String>> layers, List<String> orphans) {
    }

    private final LayoutSettings settings;

    public LayerAssigner(LayoutSettings settings) {
        this.settings = settings;
    }

    public Layering assign(ActivityGraph graph, Diagnostics diagnostics) {
        List<String> controlIds = graph.nodes().stream()
                .filter(FlowNode::isControlNode)
                .map(FlowNode::id)
                .toList();

        Map<String, List<ControlFlow>> outgoing = new LinkedHashMap<>();
        Map<String, Integer> incomingCount = new HashMap<>();
        for (String id : controlIds) {
            outgoing.put(id, new ArrayList<>());
            incomingCount.put(id, 0);
        }
        for (ControlFlow edge : graph.edges()) {
            if (!outgoing.containsKey(edge.source()) || !outgoing.containsKey(edge.target())
                    || edge.source().equals(edge.target())) {
                continue;
            }
            outgoing.get(edge.source()).add(edge);
            incomingCount.merge(edge.target(), 1, Integer::sum);
        }

        Set<String> roots = new LinkedHashSet<>();
        for (String id : controlIds) {
            if (graph.node(id).kind() == NodeKind.INITIAL) {
                roots.add(id);
            }
        }
        for (String id : controlIds) {
            if (incomingCount.get(id) == 0) {
                roots.add(id);
            }
        }

        Set<String> backEdges = new HashSet<>();
        Set<String> visited = findBackEdges(roots, outgoing, backEdges);

        Map<String, Integer> layerOf = levelForwardEdges(roots, visited, outgoing, backEdges);

        if (settings.finalsOnLastLayer()) {
            int deepestNonFinal = layerOf.entrySet().stream()
                    .filter(e -> graph.node(e.getKey()).kind() != NodeKind.FINAL)
                    .mapToInt(Map.Entry::getValue)
                    .max()
                    .orElse(-1);
            for (String id : controlIds) {
                if (layerOf.containsKey(id) && graph.node(id).kind() == NodeKind.FINAL) {
                    layerOf.put(id, deepestNonFinal + 1);
                }
            }
        }

        // compress empty layers
        TreeSet<Integer> usedLayers = new TreeSet<>(layerOf.values());
        Map<Integer, Integer> compact = new HashMap<>();
        for (int used : usedLayers) {
            compact.put(used, compact.size());
        }

        List<List<String>> layers = new ArrayList<>();
        for (int i = 0; i < compact.size(); i++) {
            layers.add(new ArrayList<>());
        }
        List<String> orphans = new ArrayList<>();
        for (String id : controlIds) {
            Integer layer = layerOf.get(id);
            if (layer == null) {
                orphans.add(id);
                diagnostics.report(DiagnosticCode.ORPHAN_LAYER_NODE, id,
                        "Node '" + describe(graph.node(id)) + "' could not be leveled and was placed in the orphan layer");
            } else {
                int compacted = compact.get(layer);
                layerOf.put(id, compacted);
                layers.get(compacted).add(id);
            }
        }

        for (FlowNode node : graph.nodesOfKind(NodeKind.NOTE)) {
            String annotated = ((NoteNode) node).annotatedNodeId();
            Integer layer = annotated == null ? null : layerOf.get(annotated);
            if (layer != null && !orphans.contains(annotated)) {
                layers.get(layer).add(node.id());
            } else {
                orphans.add(node.id());
            }
        }

        return new Layering(layers, orphans);
    }

    private Set<String> findBackEdges(Set<String> roots, Map<String, List<ControlFlow>> outgoing, Set<String> backEdges) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String root : roots) {
            if (visited.contains(root)) {
                continue;
            }
            Deque<DfsFrame> stack = new ArrayDeque<>();
            stack.push(new DfsFrame(root));
            visited.add(root);
            onStack.add(root);

            while (!stack.isEmpty()) {
                DfsFrame frame = stack.peek();
                List<ControlFlow> edges = outgoing.get(frame.node);
                if (frame.nextEdge >= edges.size()) {
                    stack.pop();
                    onStack.remove(frame.node);
                    continue;
                }
                ControlFlow edge = edges.get(frame.nextEdge++);
                String target = edge.target();
                if (onStack.contains(target)) {
                    backEdges.add(edge.id());
                } else if (visited.add(target)) {
                    onStack.add(target);
                    stack.push(new DfsFrame(target));
                }
            }
        }
        return visited;
    }

    private Map<String, Integer> levelForwardEdges(Set<String> roots, Set<String> visited,
                                                   Map<String, List<ControlFlow>> outgoing, Set<String> backEdges) {
        Map<String, Integer> pending = new HashMap<>();
        for (String id : visited) {
            pending.put(id, 0);
        }
        for (String id : visited) {
            for (ControlFlow edge : outgoing.get(id)) {
                if (!backEdges.contains(edge.id()) && visited.contains(edge.target())) {
                    pending.merge(edge.target(), 1, Integer::sum);
                }
            }
        }

        Map<String, Integer> layerOf = new HashMap<>();
        Deque<String> worklist = new ArrayDeque<>();
        for (String root : roots) {
            if (pending.get(root) == 0) {
                layerOf.put(root, 0);
                worklist.add(root);
            }
        }

        int processed = 0;
        while (!worklist.isEmpty() && processed < settings.levelingPassCap()) {
            String node = worklist.poll();
            processed++;
            int layer = layerOf.get(node);
            for (ControlFlow edge : outgoing.get(node)) {
                String target = edge.target();
                if (backEdges.contains(edge.id()) || !visited.contains(target)) {
                    continue;
                }
                layerOf.merge(target, layer + 1, Math::max);
                if (pending.merge(target, -1, Integer::sum) == 0) {
                    worklist.add(target);
                }
            }
        }
        // anything still pending after the cap was hit stays unleveled
        layerOf.keySet().retainAll(levelledOnly(layerOf, pending));
        return layerOf;
    }

    private static Set<String> levelledOnly(Map<String, Integer> layerOf, Map<String, Integer> pending) {
        Set<String> done = new HashSet<>();
        for (String id : layerOf.keySet()) {
            if (pending.getOrDefault(id, 0) == 0) {
                done.add(id);
            }
        }
        return done;
    }

    private static final class DfsFrame {
        private final String node;
        private int nextEdge;

        private DfsFrame(String node) {
            this.node = node;
        }
    }

    private static String describe(FlowNode node) {
        return node.hasLabel() ? node.label() : node.kind().displayName() + " " + node.id();
    }
}
