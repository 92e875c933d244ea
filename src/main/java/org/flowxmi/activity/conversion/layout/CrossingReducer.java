package org.flowxmi.activity.conversion.layout;

import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reorders nodes within their layers by the barycenter of their neighbours to cut down edge crossings.
 * Sorting is stable, so ties keep the graph order and the result is deterministic.
 */
public class CrossingReducer {

    /**
     * Runs alternating downward and upward barycenter sweeps over the layers, in place.
     *
     * @param graph  the graph providing edges
     * @param layers node ids per layer, reordered in place
     * @param sweeps number of down+up sweep pairs
     */
    public static void reduce(ActivityGraph graph, List<List<String>> layers, int sweeps) {
        if (layers.size() < 2 || sweeps <= 0) {
            return;
        }
        Map<String, List<String>> predecessors = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (ControlFlow edge : graph.edges()) {
            predecessors.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
            successors.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }

        for (int sweep = 0; sweep < sweeps; sweep++) {
            for (int i = 1; i < layers.size(); i++) {
                orderByBarycenter(layers.get(i), layers.get(i - 1), predecessors);
            }
            for (int i = layers.size() - 2; i >= 0; i--) {
                orderByBarycenter(layers.get(i), layers.get(i + 1), successors);
            }
        }
    }

    private static void orderByBarycenter(List<String> layer, List<String> fixedLayer,
                                          Map<String, List<String>> neighbours) {
        Map<String, Integer> fixedPosition = new HashMap<>();
        for (int i = 0; i < fixedLayer.size(); i++) {
            fixedPosition.put(fixedLayer.get(i), i);
        }

        Map<String, Double> barycenter = new HashMap<>();
        for (int i = 0; i < layer.size(); i++) {
            String node = layer.get(i);
            double sum = 0;
            int count = 0;
            for (String neighbour : neighbours.getOrDefault(node, List.of())) {
                Integer position = fixedPosition.get(neighbour);
                if (position != null) {
                    sum += position;
                    count++;
                }
            }
            // nodes without neighbours in the fixed layer keep their slot
            barycenter.put(node, count == 0 ? i : sum / count);
        }
        layer.sort(Comparator.comparingDouble(barycenter::get));
    }
}
