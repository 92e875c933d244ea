package org.flowxmi.activity.conversion.xmi;

import org.flowxmi.activity.conversion.ConversionContext;
import org.flowxmi.activity.conversion.IdAllocator;
import org.flowxmi.activity.conversion.config.models.DiagramConfig;
import org.flowxmi.activity.conversion.diagnostics.DiagnosticCode;
import org.flowxmi.activity.conversion.diagnostics.Diagnostics;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.graph.models.NoteNode;
import org.flowxmi.activity.conversion.graph.models.Swimlane;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.flowxmi.activity.conversion.layout.models.SwimlaneBounds;
import org.flowxmi.activity.conversion.repair.BranchClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a repaired, laid-out activity graph as an XMI 2.1 document that Enterprise Architect
 * imports with its diagram intact.
 * <p>
 * The document has two parts: the UML model ({@code uml:Model} / package / activity with nodes,
 * comments, edges and partitions) and the EA extension written by {@link EaExtensionWriter}.
 * Geometry is checked through {@link FallbackGeometry} right before emission. Edges that still
 * point at a missing node are skipped and reported, the rest of the document is produced.
 */
public class XmiActivitySerializer {
    private static final Logger log = LoggerFactory.getLogger(XmiActivitySerializer.class);

    public static final String XMI_NAMESPACE = "http://schema.omg.org/spec/XMI/2.1";
    public static final String UML_NAMESPACE = "http://schema.omg.org/spec/UML/2.1";

    static final int COMMENT_NAME_LIMIT = 80;
    private static final int FALLBACK_LANE_LEFT = 100;
    private static final int FALLBACK_LANE_STEP = 280;
    private static final int FALLBACK_LANE_WIDTH = 250;
    private static final int FALLBACK_LANE_TOP = 100;
    private static final int FALLBACK_LANE_HEIGHT = 1050;

    private final DiagramConfig diagramConfig;
    private final BranchClassifier classifier;
    private final String timestamp;

    /**
     * @param diagramConfig package name, author and action numbering
     * @param classifier    colors success and failure actions; may be null
     * @param timestamp     written as the diagram's created/modified date; null leaves them empty
     */
    public XmiActivitySerializer(DiagramConfig diagramConfig, BranchClassifier classifier, String timestamp) {
        this.diagramConfig = diagramConfig == null ? new DiagramConfig() : diagramConfig;
        this.classifier = classifier;
        this.timestamp = timestamp;
    }

    public String serialize(ActivityGraph graph, DiagramLayout layout, ConversionContext context) {
        Document doc = newDocument();
        XmiDocumentModel model = prepare(graph, layout, context);

        Element root = doc.createElement("xmi:XMI");
        root.setAttribute("xmi:version", "2.1");
        root.setAttribute("xmlns:xmi", XMI_NAMESPACE);
        root.setAttribute("xmlns:uml", UML_NAMESPACE);
        doc.appendChild(root);

        Element documentation = doc.createElement("xmi:Documentation");
        documentation.setAttribute("exporter", "Enterprise Architect");
        documentation.setAttribute("exporterVersion", "6.5");
        documentation.setAttribute("exporterID", "1560");
        root.appendChild(documentation);

        Map<String, String> guardIds = new LinkedHashMap<>();
        for (ControlFlow edge : model.edges) {
            if (edge.hasGuard()) {
                guardIds.put(edge.id(), context.ids().nextElementId());
            }
        }

        root.appendChild(createUmlModel(doc, model, guardIds, context.diagnostics()));
        root.appendChild(new EaExtensionWriter(doc, model, diagramConfig, classifier, timestamp).write());

        String xml = writeDocument(doc);
        log.info("Serialized '{}': {} nodes, {} edges, {} swimlanes",
                graph.name(), graph.nodeCount(), model.edges.size(), graph.swimlanes().size());
        return xml;
    }

    /** Serializes and writes the result to {@code outputFile} as UTF-8. */
    public void serializeToFile(ActivityGraph graph, DiagramLayout layout, ConversionContext context, Path outputFile) {
        String xml = serialize(graph, layout, context);
        try {
            Files.writeString(outputFile, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SerializationException("Failed to write XMI document: " + outputFile, e);
        }
    }

    // ------ preparation

    private XmiDocumentModel prepare(ActivityGraph graph, DiagramLayout layout, ConversionContext context) {
        Diagnostics diagnostics = context.diagnostics();
        Map<String, NodeGeometry> geometry = FallbackGeometry.resolve(graph, layout, diagnostics);
        List<ControlFlow> edges = emittableEdges(graph, diagnostics);
        Map<String, SwimlaneBounds> laneBounds = resolveLaneBounds(graph, layout, diagnostics);

        IdAllocator ids = context.ids();
        String packageId = ids.nextPackageId();
        String activityId = ids.nextElementId();
        String diagramId = ids.nextElementId();

        return new XmiDocumentModel(graph, geometry, laneBounds, edges, displayNames(graph),
                packageId, activityId, diagramId, layout.canvasWidth(), layout.canvasHeight());
    }

    private static List<ControlFlow> emittableEdges(ActivityGraph graph, Diagnostics diagnostics) {
        List<ControlFlow> result = new ArrayList<>();
        for (ControlFlow edge : graph.edges()) {
            FlowNode source = graph.node(edge.source());
            FlowNode target = graph.node(edge.target());
            String problem = null;
            if (source == null || target == null) {
                problem = "references a missing node";
            } else if (source.kind() == NodeKind.FINAL) {
                problem = "leaves a Final node";
            } else if (!source.isControlNode() || !target.isControlNode()) {
                problem = "connects a note";
            }
            if (problem == null) {
                result.add(edge);
            } else {
                diagnostics.report(DiagnosticCode.ELEMENT_SKIPPED, edge.id(),
                        "Control flow " + edge.source() + " -> " + edge.target() + " " + problem + " and was not written");
            }
        }
        return result;
    }

    private static Map<String, SwimlaneBounds> resolveLaneBounds(ActivityGraph graph, DiagramLayout layout, Diagnostics diagnostics) {
        Map<String, SwimlaneBounds> result = new LinkedHashMap<>();
        int index = 0;
        for (Swimlane lane : graph.swimlanes()) {
            SwimlaneBounds bounds = layout.swimlaneBounds(lane.name());
            if (bounds == null || bounds.width() <= 0 || bounds.height() <= 0) {
                int left = FALLBACK_LANE_LEFT + index * FALLBACK_LANE_STEP;
                bounds = new SwimlaneBounds(left, FALLBACK_LANE_TOP,
                        left + FALLBACK_LANE_WIDTH, FALLBACK_LANE_TOP + FALLBACK_LANE_HEIGHT);
                diagnostics.report(DiagnosticCode.FALLBACK_GEOMETRY, lane.id(),
                        "Swimlane '" + lane.name() + "' had no usable bounds; placed at column " + index);
            }
            result.put(lane.name(), bounds);
            index++;
        }
        return result;
    }

    private Map<String, String> displayNames(ActivityGraph graph) {
        Map<String, String> names = new LinkedHashMap<>();
        int actionNumber = 0;
        for (FlowNode node : graph.nodes()) {
            String label = node.hasLabel() ? node.label().trim() : "";
            if (node.kind() == NodeKind.ACTION && diagramConfig.numberActions) {
                actionNumber++;
                label = String.format("%s%02d. %s", diagramConfig.actionNumberPrefix, actionNumber, label).trim();
            } else if (node.kind() == NodeKind.NOTE) {
                label = commentName(label);
            }
            names.put(node.id(), label);
        }
        return names;
    }

    static String commentName(String text) {
        if (text == null || text.isBlank()) {
            return "Note";
        }
        String singleLine = text.strip().replaceAll("\\s+", " ");
        return singleLine.length() > COMMENT_NAME_LIMIT ? singleLine.substring(0, COMMENT_NAME_LIMIT) : singleLine;
    }

    // ------ UML model section

    private Element createUmlModel(Document doc, XmiDocumentModel model, Map<String, String> guardIds, Diagnostics diagnostics) {
        Element umlModel = doc.createElement("uml:Model");
        umlModel.setAttribute("xmi:type", "uml:Model");
        umlModel.setAttribute("name", "EA_Model");
        umlModel.setAttribute("visibility", "public");

        Element umlPackage = doc.createElement("packagedElement");
        umlPackage.setAttribute("xmi:type", "uml:Package");
        umlPackage.setAttribute("xmi:id", model.packageId);
        umlPackage.setAttribute("name", diagramConfig.packageName);
        umlPackage.setAttribute("visibility", "public");
        umlModel.appendChild(umlPackage);

        Element activity = doc.createElement("packagedElement");
        activity.setAttribute("xmi:type", "uml:Activity");
        activity.setAttribute("xmi:id", model.activityId);
        activity.setAttribute("name", model.graph.name());
        activity.setAttribute("visibility", "public");
        umlPackage.appendChild(activity);

        for (Swimlane lane : model.graph.swimlanes()) {
            Element group = doc.createElement("group");
            group.setAttribute("xmi:type", "uml:ActivityPartition");
            group.setAttribute("xmi:id", lane.id());
            group.setAttribute("name", lane.name());
            group.setAttribute("visibility", "public");
            for (FlowNode member : model.graph.nodesInSwimlane(lane.name())) {
                if (member.isControlNode()) {
                    appendIdref(doc, group, "node", member.id());
                }
            }
            activity.appendChild(group);
        }

        for (FlowNode node : model.graph.nodes()) {
            if (node.isControlNode()) {
                activity.appendChild(createNode(doc, model, node));
            }
        }
        for (FlowNode node : model.graph.nodesOfKind(NodeKind.NOTE)) {
            activity.appendChild(createComment(doc, model, (NoteNode) node, diagnostics));
        }
        for (ControlFlow edge : model.edges) {
            activity.appendChild(createEdge(doc, edge, guardIds.get(edge.id())));
        }
        return umlModel;
    }

    private Element createNode(Document doc, XmiDocumentModel model, FlowNode node) {
        Element element = doc.createElement("node");
        element.setAttribute("xmi:type", XmiStyles.umlType(node.kind()));
        element.setAttribute("xmi:id", node.id());
        String name = model.nameOf(node);
        if (!name.isEmpty()) {
            element.setAttribute("name", name);
        }
        element.setAttribute("visibility", "public");
        String partitionId = model.partitionId(node);
        if (partitionId != null) {
            element.setAttribute("inPartition", partitionId);
        }
        for (ControlFlow edge : model.edges) {
            if (edge.target().equals(node.id())) {
                appendIdref(doc, element, "incoming", edge.id());
            }
        }
        for (ControlFlow edge : model.edges) {
            if (edge.source().equals(node.id())) {
                appendIdref(doc, element, "outgoing", edge.id());
            }
        }
        return element;
    }

    private Element createComment(Document doc, XmiDocumentModel model, NoteNode note, Diagnostics diagnostics) {
        Element comment = doc.createElement("ownedComment");
        comment.setAttribute("xmi:type", "uml:Comment");
        comment.setAttribute("xmi:id", note.id());
        comment.setAttribute("name", model.nameOf(note));
        comment.setAttribute("visibility", "public");

        Element body = doc.createElement("body");
        body.setTextContent(note.hasLabel() ? note.label() : "");
        comment.appendChild(body);

        String annotated = note.annotatedNodeId();
        if (annotated != null) {
            if (model.graph.hasNode(annotated)) {
                appendIdref(doc, comment, "annotatedElement", annotated);
            } else {
                diagnostics.report(DiagnosticCode.ELEMENT_SKIPPED, note.id(),
                        "Note annotates missing node " + annotated + "; the link was not written");
            }
        }
        return comment;
    }

    private static Element createEdge(Document doc, ControlFlow edge, String guardId) {
        Element element = doc.createElement("edge");
        element.setAttribute("xmi:type", "uml:ControlFlow");
        element.setAttribute("xmi:id", edge.id());
        if (edge.hasGuard()) {
            element.setAttribute("name", edge.guard());
        }
        element.setAttribute("visibility", "public");
        element.setAttribute("source", edge.source());
        element.setAttribute("target", edge.target());
        if (edge.hasGuard()) {
            Element guard = doc.createElement("guard");
            guard.setAttribute("xmi:type", "uml:LiteralString");
            guard.setAttribute("xmi:id", guardId);
            guard.setAttribute("value", edge.guard());
            element.appendChild(guard);
        }
        return element;
    }

    private static void appendIdref(Document doc, Element parent, String tag, String idref) {
        Element child = doc.createElement(tag);
        child.setAttribute("xmi:idref", idref);
        parent.appendChild(child);
    }

    // ------ DOM plumbing

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document doc = builder.newDocument();
            doc.setXmlStandalone(true);
            return doc;
        } catch (ParserConfigurationException e) {
            throw new SerializationException("Failed to create XMI document", e);
        }
    }

    static String writeDocument(Document doc) {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.STANDALONE, "yes");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));

            String xmlContent = stringWriter.toString();
            xmlContent = xmlContent.replaceAll(" standalone=\"yes\"", "");
            xmlContent = xmlContent.replaceAll(" standalone=\"no\"", "");
            // Transformer leaves whitespace-only lines between elements
            return xmlContent.replaceAll("(\r?\n)\\s*\r?\n", "$1");
        } catch (TransformerException e) {
            throw new SerializationException("Failed to write XMI document", e);
        }
    }
}
