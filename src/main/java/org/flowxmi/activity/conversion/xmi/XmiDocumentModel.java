package org.flowxmi.activity.conversion.xmi;

import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.Swimlane;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.flowxmi.activity.conversion.layout.models.SwimlaneBounds;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the model and extension writers share for one document: the checked geometry,
 * the edges that passed emission checks, display names and the EA local-id registry.
 */
class XmiDocumentModel {
    final ActivityGraph graph;
    final Map<String, NodeGeometry> geometry;
    final Map<String, SwimlaneBounds> laneBounds;
    final List<ControlFlow> edges;
    final Map<String, String> displayNames;
    final String packageId;
    final String activityId;
    final String diagramId;
    final int canvasWidth;
    final int canvasHeight;

    private final Map<String, Integer> localIds = new HashMap<>();

    XmiDocumentModel(ActivityGraph graph, Map<String, NodeGeometry> geometry, Map<String, SwimlaneBounds> laneBounds,
                     List<ControlFlow> edges, Map<String, String> displayNames,
                     String packageId, String activityId, String diagramId, int canvasWidth, int canvasHeight) {
        this.graph = graph;
        this.geometry = geometry;
        this.laneBounds = laneBounds;
        this.edges = edges;
        this.displayNames = displayNames;
        this.packageId = packageId;
        this.activityId = activityId;
        this.diagramId = diagramId;
        this.canvasWidth = canvasWidth;
        this.canvasHeight = canvasHeight;
    }

    /** EA's numeric local id; assigned on first request, so emission order fixes the numbering. */
    String localId(String xmiId) {
        return String.valueOf(localIds.computeIfAbsent(xmiId, k -> localIds.size() + 1));
    }

    String nameOf(FlowNode node) {
        return displayNames.getOrDefault(node.id(), "");
    }

    String partitionId(FlowNode node) {
        Swimlane lane = graph.swimlane(node.swimlane());
        return lane == null ? null : lane.id();
    }
}
