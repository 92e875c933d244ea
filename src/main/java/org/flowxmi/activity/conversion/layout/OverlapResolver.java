package org.flowxmi.activity.conversion.layout;

import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.diagnostics.Diagnostics;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.layout.models.LayoutSettings;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes bounding-box collisions left by placement.
 * <p>
 * Each pass scans all node pairs in layout order. Two colliding nodes of the same layer are
 * pushed apart horizontally, each by half the overlap; for nodes of different layers the lower
 * one is pushed down by the vertical overlap. Passes stop once a pass moves nothing or the
 * iteration cap is reached; collisions still present then are reported, not fixed.
 */
public class OverlapResolver {
    private static final Logger log = LoggerFactory.getLogger(OverlapResolver.class);

    private final LayoutSettings settings;

    public OverlapResolver(LayoutSettings settings) {
        this.settings = settings;
    }

    /**
     * @return the number of passes that moved at least one node
     */
    public int resolve(DiagramLayout layout, Diagnostics diagnostics) {
        List<String> ids = new ArrayList<>(layout.geometries().keySet());
        int passes = 0;

        for (int iteration = 0; iteration < settings.overlapIterationCap(); iteration++) {
            boolean moved = false;
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    NodeGeometry a = layout.geometry(ids.get(i));
                    NodeGeometry b = layout.geometry(ids.get(j));
                    if (!a.overlaps(b)) {
                        continue;
                    }
                    moved = true;
                    if (a.layer() == b.layer()) {
                        separateHorizontally(layout, ids.get(i), a, ids.get(j), b);
                    } else {
                        pushLowerDown(layout, ids.get(i), a, ids.get(j), b);
                    }
                }
            }
            if (!moved) {
                break;
            }
            passes++;
        }

        keepInsideMargins(layout);
        reportRemaining(layout, ids, diagnostics);
        if (passes > 0) {
            log.info("Overlap resolution moved nodes in {} pass(es)", passes);
        }
        return passes;
    }

    private static void separateHorizontally(DiagramLayout layout, String idA, NodeGeometry a, String idB, NodeGeometry b) {
        // on equal x the earlier node goes left
        boolean aIsLeft = a.x() <= b.x();
        NodeGeometry left = aIsLeft ? a : b;
        NodeGeometry right = aIsLeft ? b : a;
        int overlap = left.right() - right.x();
        int leftShift = overlap / 2;
        int rightShift = overlap - leftShift;

        layout.place(aIsLeft ? idA : idB, left.withPosition(left.x() - leftShift, left.y()));
        layout.place(aIsLeft ? idB : idA, right.withPosition(right.x() + rightShift, right.y()));
    }

    private static void pushLowerDown(DiagramLayout layout, String idA, NodeGeometry a, String idB, NodeGeometry b) {
        boolean aIsLower = a.y() > b.y() || (a.y() == b.y() && a.layer() > b.layer());
        NodeGeometry upper = aIsLower ? b : a;
        NodeGeometry lower = aIsLower ? a : b;
        int overlap = upper.bottom() - lower.y();
        layout.place(aIsLower ? idA : idB, lower.withPosition(lower.x(), lower.y() + overlap));
    }

    // Translates everything back right of the margin if nodes were pushed past it, then grows the canvas.
    private void keepInsideMargins(DiagramLayout layout) {
        if (layout.geometries().isEmpty()) {
            return;
        }
        int minX = layout.geometries().values().stream().mapToInt(NodeGeometry::x).min().getAsInt();
        int shift = minX < settings.marginX() / 2 ? settings.marginX() / 2 - minX : 0;
        if (shift > 0) {
            for (String id : new ArrayList<>(layout.geometries().keySet())) {
                NodeGeometry g = layout.geometry(id);
                layout.place(id, g.withPosition(g.x() + shift, g.y()));
            }
        }

        int maxRight = layout.geometries().values().stream().mapToInt(NodeGeometry::right).max().getAsInt();
        int maxBottom = layout.geometries().values().stream().mapToInt(NodeGeometry::bottom).max().getAsInt();
        layout.resizeCanvas(
                Math.max(layout.canvasWidth(), maxRight + settings.marginX()),
                Math.max(layout.canvasHeight(), maxBottom + settings.marginY()));
    }

    private static void reportRemaining(DiagramLayout layout, List<String> ids, Diagnostics diagnostics) {
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                if (layout.geometry(ids.get(i)).overlaps(layout.geometry(ids.get(j)))) {
                    diagnostics.report(DiagnosticCode.UNRESOLVED_OVERLAP, ids.get(i),
                            "Node still overlaps " + ids.get(j) + " after the iteration cap");
                }
            }
        }
    }
}
