package org.flowxmi.activity.conversion.layout.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of the layout phases: node geometry, layer structure, swimlane bounds and canvas size.
 * Geometry is updated in place by the overlap resolver.
 */
public class DiagramLayout {
    private final Map<String, NodeGeometry> geometry = new LinkedHashMap<>();
    private final List<List<String>> layers = new ArrayList<>();
    private final List<String> orphanIds = new ArrayList<>();
    private final Map<String, SwimlaneBounds> swimlaneBounds = new LinkedHashMap<>();
    private final Map<String, LaneBlock> laneBlocks = new LinkedHashMap<>();
    private int canvasWidth;
    private int canvasHeight;
    private int columnPitch;
    private int rowPitch;

    public DiagramLayout(int canvasWidth, int canvasHeight) {
        this.canvasWidth = canvasWidth;
        this.canvasHeight = canvasHeight;
    }

    public NodeGeometry geometry(String nodeId) {
        return geometry.get(nodeId);
    }

    public void place(String nodeId, NodeGeometry nodeGeometry) {
        geometry.put(nodeId, nodeGeometry);
    }

    public Map<String, NodeGeometry> geometries() {
        return Collections.unmodifiableMap(geometry);
    }

    /** Node ids per layer, top to bottom; the orphan layer, if any, is the last entry. */
    public List<List<String>> layers() {
        return layers;
    }

    public List<String> orphanIds() {
        return orphanIds;
    }

    public Map<String, SwimlaneBounds> swimlaneBounds() {
        return swimlaneBounds;
    }

    public SwimlaneBounds swimlaneBounds(String laneName) {
        return swimlaneBounds.get(laneName);
    }

    /** Grid column block per swimlane name. */
    public Map<String, LaneBlock> laneBlocks() {
        return laneBlocks;
    }

    public int canvasWidth() {
        return canvasWidth;
    }

    public int canvasHeight() {
        return canvasHeight;
    }

    public void resizeCanvas(int width, int height) {
        this.canvasWidth = width;
        this.canvasHeight = height;
    }

    public int columnPitch() {
        return columnPitch;
    }

    public int rowPitch() {
        return rowPitch;
    }

    public void setPitch(int columnPitch, int rowPitch) {
        this.columnPitch = columnPitch;
        this.rowPitch = rowPitch;
    }
}
