package org.flowxmi.activity.conversion.xmi;

import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.diagnostics.Diagnostics;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.layout.DimensionCalculator;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.flowxmi.activity.conversion.layout.models.Size;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Final geometry check before emission. Nodes with missing or unusable geometry are given a
 * deterministic position inside a zone of the canvas chosen by their kind, derived from a hash
 * of the node id.
 */
public class FallbackGeometry {
    private static final int MAX_PROBES = 64;
    private static final int PROBE_GAP = 10;

    /**
     * @return usable geometry for every node of the graph, in graph order
     */
    public static Map<String, NodeGeometry> resolve(ActivityGraph graph, DiagramLayout layout, Diagnostics diagnostics) {
        int canvasWidth = layout.canvasWidth();
        int canvasHeight = layout.canvasHeight();

        Map<String, NodeGeometry> accepted = new LinkedHashMap<>();
        Set<Long> anchors = new HashSet<>();
        List<FlowNode> needFallback = new ArrayList<>();
        Map<String, String> reasons = new LinkedHashMap<>();

        for (FlowNode node : graph.nodes()) {
            NodeGeometry geometry = layout.geometry(node.id());
            String problem = check(geometry, canvasWidth, canvasHeight);
            if (problem == null && !anchors.add(anchorKey(geometry.x(), geometry.y()))) {
                problem = "shares its anchor with another node";
            }
            if (problem == null) {
                accepted.put(node.id(), geometry);
            } else {
                needFallback.add(node);
                reasons.put(node.id(), problem);
            }
        }

        for (FlowNode node : needFallback) {
            NodeGeometry previous = layout.geometry(node.id());
            NodeGeometry fallback = place(node, previous, canvasWidth, canvasHeight, anchors);
            accepted.put(node.id(), fallback);
            diagnostics.report(DiagnosticCode.FALLBACK_GEOMETRY, node.id(),
                    node.kind().displayName() + " geometry " + reasons.get(node.id())
                            + "; placed at (" + fallback.x() + ", " + fallback.y() + ")");
        }

        // restore graph order
        Map<String, NodeGeometry> ordered = new LinkedHashMap<>();
        for (FlowNode node : graph.nodes()) {
            ordered.put(node.id(), accepted.get(node.id()));
        }
        return ordered;
    }

    static String check(NodeGeometry geometry, int canvasWidth, int canvasHeight) {
        if (geometry == null) {
            return "is missing";
        }
        if (geometry.width() <= 0 || geometry.height() <= 0) {
            return "has a non-positive size";
        }
        if (geometry.x() < 0 || geometry.y() < 0 || geometry.right() > canvasWidth || geometry.bottom() > canvasHeight) {
            return "lies outside the canvas";
        }
        return null;
    }

    private static NodeGeometry place(FlowNode node, NodeGeometry previous, int canvasWidth, int canvasHeight, Set<Long> anchors) {
        int width;
        int height;
        if (previous != null && previous.width() > 0 && previous.height() > 0) {
            width = previous.width();
            height = previous.height();
        } else {
            Size size = DimensionCalculator.dimensionsFor(node.kind(), node.labelLength());
            width = size.width();
            height = size.height();
        }

        double[] zone = zoneFor(node);
        int zoneLeft = (int) (zone[0] * canvasWidth);
        int zoneRight = Math.max(zoneLeft + width, (int) (zone[1] * canvasWidth));
        int zoneTop = (int) (zone[2] * canvasHeight);
        int zoneBottom = Math.max(zoneTop + height, (int) (zone[3] * canvasHeight));

        int hash = node.id().hashCode() & 0x7fffffff;
        int x = zoneLeft + hash % Math.max(1, zoneRight - zoneLeft - width);
        int y = zoneTop + (hash / 7) % Math.max(1, zoneBottom - zoneTop - height);

        for (int probe = 0; probe < MAX_PROBES && anchors.contains(anchorKey(x, y)); probe++) {
            x += width + PROBE_GAP;
            if (x + width > zoneRight) {
                x = zoneLeft;
                y += height + PROBE_GAP;
                if (y + height > zoneBottom) {
                    y = zoneTop;
                }
            }
        }

        x = Math.max(0, Math.min(canvasWidth - width, x));
        y = Math.max(0, Math.min(canvasHeight - height, y));
        anchors.add(anchorKey(x, y));
        return new NodeGeometry(x, y, width, height, -1);
    }

    // {left, right, top, bottom} as fractions of the canvas
    private static double[] zoneFor(FlowNode node) {
        return switch (node.kind()) {
            case INITIAL -> new double[]{0.10, 0.80, 0.00, 0.15};
            case FINAL -> new double[]{0.10, 0.80, 0.85, 1.00};
            case DECISION, MERGE, FORK, JOIN -> new double[]{0.10, 0.80, 0.30, 0.70};
            case ACTION -> new double[]{0.10, 0.80, 0.15, 0.85};
            case NOTE -> new double[]{0.80, 1.00, 0.10, 0.90};
        };
    }

    private static long anchorKey(int x, int y) {
        return ((long) x << 32) | (y & 0xffffffffL);
    }
}
