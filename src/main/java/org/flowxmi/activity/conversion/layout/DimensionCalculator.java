package org.flowxmi.activity.conversion.layout;

import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.layout.models.Size;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node sizes by kind and label length. Pure functions, no state.
 */
public class DimensionCalculator {
    public static final int MEDIUM_LABEL_THRESHOLD = 25;
    public static final int LONG_LABEL_THRESHOLD = 40;

    private static final Size TERMINAL = new Size(25, 25);
    private static final Size DIAMOND = new Size(40, 40);
    private static final int BAR_MIN_WIDTH = 100;
    private static final int BAR_WIDTH_PER_BRANCH = 50;
    private static final int BAR_HEIGHT = 10;

    public static Size dimensionsFor(NodeKind kind, int labelLength) {
        return dimensionsFor(kind, labelLength, 1);
    }

    /**
     * Computes the size of a node.
     *
     * @param kind        the node kind
     * @param labelLength trimmed label length in characters
     * @param branchCount for fork/join bars, the larger of incoming and outgoing edge counts
     * @return the node size, always positive
     */
    public static Size dimensionsFor(NodeKind kind, int labelLength, int branchCount) {
        return switch (kind) {
            case INITIAL, FINAL -> TERMINAL;
            case DECISION, MERGE -> DIAMOND;
            case FORK, JOIN -> new Size(Math.max(BAR_MIN_WIDTH, BAR_WIDTH_PER_BRANCH * Math.max(1, branchCount)), BAR_HEIGHT);
            case ACTION -> {
                if (labelLength > LONG_LABEL_THRESHOLD) {
                    yield new Size(148, 40);
                }
                if (labelLength > MEDIUM_LABEL_THRESHOLD) {
                    yield new Size(120, 40);
                }
                yield new Size(100, 40);
            }
            case NOTE -> {
                if (labelLength > LONG_LABEL_THRESHOLD) {
                    yield new Size(160, 60);
                }
                if (labelLength > MEDIUM_LABEL_THRESHOLD) {
                    yield new Size(120, 50);
                }
                yield new Size(80, 40);
            }
        };
    }

    /**
     * Sizes every node of the graph, in graph order.
     */
    public static Map<String, Size> sizeAll(ActivityGraph graph) {
        Map<String, Size> sizes = new LinkedHashMap<>();
        for (FlowNode node : graph.nodes()) {
            int branches = Math.max(graph.outgoing(node.id()).size(), graph.incoming(node.id()).size());
            sizes.put(node.id(), dimensionsFor(node.kind(), node.labelLength(), branches));
        }
        return sizes;
    }
}
