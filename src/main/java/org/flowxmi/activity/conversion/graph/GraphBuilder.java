package org.flowxmi.activity.conversion.graph;

import org.flowxmi.activity.conversion.ConversionContext;
import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.graph.models.NoteNode;
import org.flowxmi.activity.conversion.graph.models.Swimlane;
import org.flowxmi.activity.conversion.input.ActivityInputValidator;
import org.flowxmi.activity.conversion.input.ParseInputException;
import org.flowxmi.activity.conversion.input.models.ActivityInput;
import org.flowxmi.activity.conversion.input.models.Connection;
import org.flowxmi.activity.conversion.input.models.FlowItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the flat flow/connection lists of an {@link ActivityInput} into an {@link ActivityGraph}.
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    /**
     * Builds the graph of one activity.
     * <p>
     * Every flow item gets a fresh id from the context's allocator. Labeled items of any kind that
     * repeat an existing (kind, label, swimlane) triple are merged into the first occurrence and connections are rewired to it. Connections naming unknown items are dropped.
     *
     * @param input   the validated activity input
     * @param context the conversion context (ids and diagnostics)
     * @return the graph
     * @throws ParseInputException if the input fails structural validation
     */
    public static ActivityGraph build(ActivityInput input, ConversionContext context) {
        ActivityInputValidator.validate(input);

        ActivityGraph graph = new ActivityGraph(context.diagramName());

        if (input.swimlanes != null) {
            for (String laneName : input.swimlanes) {
                String name = laneName.trim();
                if (!graph.hasSwimlane(name)) {
                    graph.addSwimlane(new Swimlane(context.ids().nextElementId(), name));
                }
            }
        }

        // input id -> graph node id (several input ids may map to one merged node)
        Map<String, String> nodeIds = new HashMap<>();
        Map<String, String> nodesByIdentity = new HashMap<>();
        Map<String, String> pendingAnnotations = new LinkedHashMap<>();

        for (FlowItem item : input.flow) {
            NodeKind kind = NodeKind.parse(item.kind)
                    .orElseThrow(() -> new ParseInputException("Unknown kind '" + item.kind + "'", List.of()));
            String label = trimToNull(item.label);
            String swimlane = trimToNull(item.swimlane);

            if (swimlane != null && !graph.hasSwimlane(swimlane)) {
                Swimlane added = new Swimlane(context.ids().nextElementId(), swimlane);
                graph.addSwimlane(added);
                context.diagnostics().report(DiagnosticCode.SWIMLANE_ADDED, added.id(),
                        "Swimlane '" + swimlane + "' referenced by '" + item.id + "' was not declared and has been added");
            }

            // blank labels never merge, so unlabeled control nodes stay apart
            String identity = label != null
                    ? kind + "|" + label + "|" + (swimlane == null ? "" : swimlane)
                    : null;
            if (identity != null && nodesByIdentity.containsKey(identity)) {
                String existing = nodesByIdentity.get(identity);
                nodeIds.put(item.id, existing);
                context.diagnostics().report(DiagnosticCode.DUPLICATE_NODE_MERGED, existing,
                        kind.displayName() + " '" + label + "' (" + item.id + ") merged into an identical node");
                continue;
            }

            String nodeId = context.ids().nextElementId();
            graph.addNode(FlowNode.of(kind, nodeId, label, swimlane, trimToNull(item.color),
                    trimToNull(item.extraActionTag), null));
            nodeIds.put(item.id, nodeId);
            if (identity != null) {
                nodesByIdentity.put(identity, nodeId);
            }
            if (kind == NodeKind.NOTE && trimToNull(item.attachedTo) != null) {
                pendingAnnotations.put(nodeId, item.attachedTo.trim());
            }
        }

        for (Map.Entry<String, String> annotation : pendingAnnotations.entrySet()) {
            String targetId = nodeIds.get(annotation.getValue());
            if (targetId == null) {
                context.diagnostics().report(DiagnosticCode.DANGLING_CONNECTION_DROPPED, annotation.getKey(),
                        "Note is attached to unknown item '" + annotation.getValue() + "'");
                continue;
            }
            NoteNode note = (NoteNode) graph.node(annotation.getKey());
            graph.replaceNode(note.withAnnotatedNodeId(targetId));
        }

        if (input.connections != null) {
            for (Connection connection : input.connections) {
                String source = nodeIds.get(connection.source);
                String target = nodeIds.get(connection.target);
                if (source == null || target == null) {
                    context.diagnostics().report(DiagnosticCode.DANGLING_CONNECTION_DROPPED, null,
                            "Connection " + connection.source + " -> " + connection.target
                                    + " references an unknown item");
                    continue;
                }
                boolean crosses = !Objects.equals(graph.node(source).swimlane(), graph.node(target).swimlane());
                graph.addEdge(new ControlFlow(context.ids().nextElementId(), source, target,
                        GuardLabels.normalize(connection.guard), crosses));
            }
        }

        log.info("Built graph '{}': {} nodes, {} edges, {} swimlanes",
                graph.name(), graph.nodeCount(), graph.edgeCount(), graph.swimlanes().size());
        return graph;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
