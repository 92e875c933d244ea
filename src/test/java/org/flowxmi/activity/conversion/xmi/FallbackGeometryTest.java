package org.flowxmi.activity.conversion.xmi;

import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.diagnostics.Diagnostics;
import org.flowxmi.activity.conversion.graph.models.ActionNode;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.FinalNode;
import org.flowxmi.activity.conversion.graph.models.InitialNode;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FallbackGeometryTest {

    @Test
    void shouldKeepValidGeometry() {
        ActivityGraph graph = graph();
        DiagramLayout layout = new DiagramLayout(800, 600);
        layout.place("s", new NodeGeometry(100, 20, 25, 25, 0));
        layout.place("a", new NodeGeometry(60, 100, 100, 40, 1));
        layout.place("b", new NodeGeometry(200, 100, 100, 40, 1));
        layout.place("f", new NodeGeometry(100, 200, 25, 25, 2));
        Diagnostics diagnostics = new Diagnostics();

        Map<String, NodeGeometry> resolved = FallbackGeometry.resolve(graph, layout, diagnostics);

        assertEquals(layout.geometries(), resolved);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void shouldReplaceMissingSharedAndOffCanvasGeometry() {
        ActivityGraph graph = graph();
        DiagramLayout layout = new DiagramLayout(800, 600);
        layout.place("s", new NodeGeometry(100, 20, 25, 25, 0));
        layout.place("a", new NodeGeometry(100, 20, 100, 40, 1));
        layout.place("b", new NodeGeometry(750, 100, 100, 40, 1));
        Diagnostics diagnostics = new Diagnostics();

        Map<String, NodeGeometry> resolved = FallbackGeometry.resolve(graph, layout, diagnostics);

        List<String> reported = diagnostics.withCode(DiagnosticCode.FALLBACK_GEOMETRY).stream()
                .map(d -> d.elementId()).toList();
        assertEquals(List.of("a", "b", "f"), reported);
        assertEquals(List.of("s", "a", "b", "f"), List.copyOf(resolved.keySet()));

        Set<String> anchors = new HashSet<>();
        for (NodeGeometry geometry : resolved.values()) {
            assertNull(FallbackGeometry.check(geometry, 800, 600));
            assertTrue(anchors.add(geometry.x() + ":" + geometry.y()));
        }
        // kept size for known boxes, default size for missing ones
        assertEquals(100, resolved.get("b").width());
        assertEquals(25, resolved.get("f").width());
    }

    @Test
    void shouldPlaceFinalNodesInLowerBand() {
        ActivityGraph graph = graph();
        DiagramLayout layout = new DiagramLayout(1000, 1000);
        Diagnostics diagnostics = new Diagnostics();

        NodeGeometry end = FallbackGeometry.resolve(graph, layout, diagnostics).get("f");

        assertTrue(end.y() >= 850, "final node at " + end);
        assertEquals(4, diagnostics.size());
    }

    @Test
    void shouldBeDeterministic() {
        DiagramLayout layout = new DiagramLayout(800, 600);

        Map<String, NodeGeometry> first = FallbackGeometry.resolve(graph(), layout, new Diagnostics());
        Map<String, NodeGeometry> second = FallbackGeometry.resolve(graph(), layout, new Diagnostics());

        assertEquals(first, second);
    }

    @Test
    void shouldRejectUnusableBoxes() {
        assertEquals("is missing", FallbackGeometry.check(null, 100, 100));
        assertEquals("has a non-positive size", FallbackGeometry.check(new NodeGeometry(0, 0, 0, 10, 0), 100, 100));
        assertEquals("lies outside the canvas", FallbackGeometry.check(new NodeGeometry(-1, 0, 10, 10, 0), 100, 100));
        assertNull(FallbackGeometry.check(new NodeGeometry(90, 90, 10, 10, 0), 100, 100));
    }

    private static ActivityGraph graph() {
        ActivityGraph graph = new ActivityGraph("Fallback");
        graph.addNode(new InitialNode("s", null, null));
        graph.addNode(ActionNode.builder().id("a").label("First").build());
        graph.addNode(ActionNode.builder().id("b").label("Second").build());
        graph.addNode(new FinalNode("f", null, null));
        return graph;
    }
}
