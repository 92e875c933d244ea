package org.flowxmi.activity.conversion.layout;

import org.flowxmi.activity.conversion.ConversionContext;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.Swimlane;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.layout.models.LaneBlock;
import org.flowxmi.activity.conversion.layout.models.LayoutSettings;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.flowxmi.activity.conversion.layout.models.Size;
import org.flowxmi.activity.conversion.layout.models.SwimlaneBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Places nodes on a layered grid.
 * <ol>
 *     <li>leveling ({@link LayerAssigner}) and in-layer ordering ({@link CrossingReducer})</li>
 *     <li>grid sizing: column and row pitch from the largest node, one column block per swimlane</li>
 *     <li>placement: each layer's nodes centered in their swimlane's block</li>
 *     <li>late placement of nodes added by repair, see {@link #placeAddedNodes}</li>
 *     <li>swimlane bounds, see {@link #computeSwimlaneBounds}</li>
 * </ol>
 */
public class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutSettings settings;

    public LayoutEngine(LayoutSettings settings) {
        this.settings = settings;
    }

    /**
     * Lays out the graph. Swimlane bounds are not computed here; call
     * {@link #computeSwimlaneBounds} once node positions are final.
     *
     * @param graph   the activity graph
     * @param sizes   node sizes from {@link DimensionCalculator}
     * @param context the conversion context
     * @return the layout with a geometry entry for every node in {@code sizes}
     */
    public DiagramLayout layout(ActivityGraph graph, Map<String, Size> sizes, ConversionContext context) {
        LayerAssigner.Layering layering = new LayerAssigner(settings).assign(graph, context.diagnostics());

        List<List<String>> rows = new ArrayList<>();
        for (List<String> layer : layering.layers()) {
            rows.add(new ArrayList<>(layer));
        }
        CrossingReducer.reduce(graph, rows, settings.crossingReductionSweeps());
        if (!layering.orphans().isEmpty()) {
            rows.add(new ArrayList<>(layering.orphans()));
        }

        int maxWidth = sizes.values().stream().mapToInt(Size::width).max().orElse(1);
        int maxHeight = sizes.values().stream().mapToInt(Size::height).max().orElse(1);
        int columnPitch = (int) Math.ceil(maxWidth * settings.columnSpacingFactor());
        int rowPitch = (int) Math.ceil(maxHeight * settings.rowSpacingFactor());

        Map<String, LaneBlock> blocks = assignLaneBlocks(graph, rows);
        int totalColumns = blocks.values().stream().mapToInt(LaneBlock::columnCount).sum();

        int canvasWidth = Math.max(settings.canvasWidth(), 2 * settings.marginX() + totalColumns * columnPitch);
        int canvasHeight = Math.max(settings.canvasHeight(), 2 * settings.marginY() + rows.size() * rowPitch);

        DiagramLayout layout = new DiagramLayout(canvasWidth, canvasHeight);
        layout.setPitch(columnPitch, rowPitch);
        layout.layers().addAll(rows);
        layout.orphanIds().addAll(layering.orphans());
        blocks.forEach((lane, block) -> {
            if (lane != null) {
                layout.laneBlocks().put(lane, block);
            }
        });

        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            double centerY = settings.marginY() + (rowIndex + 0.5) * rowPitch;
            for (Map.Entry<String, LaneBlock> entry : blocks.entrySet()) {
                List<String> members = membersOf(graph, rows.get(rowIndex), entry.getKey());
                LaneBlock block = entry.getValue();
                double offset = (block.columnCount() - members.size()) / 2.0;
                for (int i = 0; i < members.size(); i++) {
                    String nodeId = members.get(i);
                    Size size = sizes.get(nodeId);
                    double centerX = settings.marginX() + (block.firstColumn() + offset + i + 0.5) * columnPitch;
                    int x = clamp((int) Math.round(centerX - size.width() / 2.0), 0, canvasWidth - size.width());
                    int y = clamp((int) Math.round(centerY - size.height() / 2.0), 0, canvasHeight - size.height());
                    layout.place(nodeId, new NodeGeometry(x, y, size.width(), size.height(), rowIndex));
                }
            }
        }

        log.info("Laid out '{}': {} layers ({} orphans), {} columns, canvas {}x{}",
                graph.name(), layering.layers().size(), layering.orphans().size(), totalColumns,
                canvasWidth, canvasHeight);
        log.debug("Column pitch {}, row pitch {}", columnPitch, rowPitch);
        return layout;
    }

    /**
     * Places nodes that were added to the graph after {@link #layout}, such as a Final node created
     * by structural repair. Each one gets a new row below every placed node, horizontally centered
     * on its placed predecessors and kept inside its swimlane's column block.
     *
     * @return the number of nodes placed
     */
    public int placeAddedNodes(ActivityGraph graph, DiagramLayout layout) {
        int placed = 0;
        for (FlowNode node : graph.nodes()) {
            if (layout.geometry(node.id()) != null) {
                continue;
            }
            int branches = Math.max(graph.outgoing(node.id()).size(), graph.incoming(node.id()).size());
            Size size = DimensionCalculator.dimensionsFor(node.kind(), node.labelLength(), branches);

            int row = layout.layers().size();
            int maxBottom = layout.geometries().values().stream().mapToInt(NodeGeometry::bottom).max().orElse(0);
            int gridTop = settings.marginY() + row * layout.rowPitch() + (layout.rowPitch() - size.height()) / 2;
            int y = Math.max(gridTop, maxBottom + layout.rowPitch() / 2);

            List<NodeGeometry> predecessors = graph.incoming(node.id()).stream()
                    .map(e -> layout.geometry(e.source()))
                    .filter(Objects::nonNull)
                    .toList();
            LaneBlock block = node.swimlane() == null ? null : layout.laneBlocks().get(node.swimlane());
            int centerX;
            if (!predecessors.isEmpty()) {
                centerX = (int) Math.round(predecessors.stream().mapToInt(NodeGeometry::centerX).average().getAsDouble());
            } else if (block != null) {
                centerX = settings.marginX() + (int) Math.round((block.firstColumn() + block.columnCount() / 2.0) * layout.columnPitch());
            } else {
                centerX = layout.canvasWidth() / 2;
            }
            int x = centerX - size.width() / 2;
            if (block != null) {
                int blockLeft = settings.marginX() + block.firstColumn() * layout.columnPitch();
                int blockRight = blockLeft + block.columnCount() * layout.columnPitch();
                x = clamp(x, blockLeft, Math.max(blockLeft, blockRight - size.width()));
            }
            x = Math.max(0, x);

            layout.place(node.id(), new NodeGeometry(x, y, size.width(), size.height(), row));
            layout.layers().add(new ArrayList<>(List.of(node.id())));
            layout.resizeCanvas(
                    Math.max(layout.canvasWidth(), x + size.width() + settings.marginX()),
                    Math.max(layout.canvasHeight(), y + size.height() + settings.marginY()));
            placed++;
            log.debug("Placed added node {} at {},{} in row {}", node.id(), x, y, row);
        }
        return placed;
    }

    /**
     * Derives each swimlane's bounding box from the final geometry of its member nodes,
     * expanded by the lane margins and clamped to the canvas. Lanes without members
     * span their column block over the full grid height.
     */
    public void computeSwimlaneBounds(ActivityGraph graph, DiagramLayout layout) {
        layout.swimlaneBounds().clear();
        int rows = Math.max(1, layout.layers().size());

        for (Swimlane lane : graph.swimlanes()) {
            List<NodeGeometry> members = graph.nodesInSwimlane(lane.name()).stream()
                    .map(n -> layout.geometry(n.id()))
                    .filter(Objects::nonNull)
                    .toList();

            SwimlaneBounds bounds;
            if (!members.isEmpty()) {
                int left = members.stream().mapToInt(NodeGeometry::x).min().getAsInt() - settings.laneMarginX();
                int right = members.stream().mapToInt(NodeGeometry::right).max().getAsInt() + settings.laneMarginX();
                int top = members.stream().mapToInt(NodeGeometry::y).min().getAsInt() - settings.laneMarginTop();
                int bottom = members.stream().mapToInt(NodeGeometry::bottom).max().getAsInt() + settings.laneMarginBottom();
                bounds = new SwimlaneBounds(
                        clamp(left, 0, layout.canvasWidth()),
                        clamp(top, 0, layout.canvasHeight()),
                        clamp(right, 0, layout.canvasWidth()),
                        clamp(bottom, 0, layout.canvasHeight()));
            } else {
                LaneBlock block = layout.laneBlocks().getOrDefault(lane.name(), new LaneBlock(0, 1));
                int left = settings.marginX() + block.firstColumn() * layout.columnPitch();
                int top = settings.marginY();
                bounds = new SwimlaneBounds(
                        clamp(left, 0, layout.canvasWidth()),
                        top,
                        clamp(left + block.columnCount() * layout.columnPitch(), 0, layout.canvasWidth()),
                        clamp(top + rows * layout.rowPitch(), 0, layout.canvasHeight()));
            }
            layout.swimlaneBounds().put(lane.name(), bounds);
        }
    }

    // lane name (null for nodes outside any lane) -> column block, in swimlane order
    private static Map<String, LaneBlock> assignLaneBlocks(ActivityGraph graph, List<List<String>> rows) {
        List<String> laneOrder = new ArrayList<>();
        for (Swimlane lane : graph.swimlanes()) {
            laneOrder.add(lane.name());
        }
        boolean hasLaneless = graph.nodes().stream().anyMatch(n -> n.swimlane() == null);
        if (hasLaneless || laneOrder.isEmpty()) {
            laneOrder.add(null);
        }

        Map<String, LaneBlock> blocks = new LinkedHashMap<>();
        int nextColumn = 0;
        for (String lane : laneOrder) {
            int width = 1;
            for (List<String> row : rows) {
                width = Math.max(width, membersOf(graph, row, lane).size());
            }
            blocks.put(lane, new LaneBlock(nextColumn, width));
            nextColumn += width;
        }
        return blocks;
    }

    private static List<String> membersOf(ActivityGraph graph, List<String> row, String lane) {
        List<String> members = new ArrayList<>();
        for (String nodeId : row) {
            FlowNode node = graph.node(nodeId);
            if (Objects.equals(node.swimlane(), lane)) {
                members.add(nodeId);
            }
        }
        return members;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
