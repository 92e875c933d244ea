package org.flowxmi.activity.conversion.xmi;

import org.flowxmi.activity.conversion.config.models.DiagramConfig;
import org.flowxmi.activity.conversion.graph.models.ActionNode;
import org.flowxmi.activity.conversion.graph.models.ControlFlow;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.graph.models.Swimlane;
import org.flowxmi.activity.conversion.layout.models.NodeGeometry;
import org.flowxmi.activity.conversion.layout.models.SwimlaneBounds;
import org.flowxmi.activity.conversion.repair.BranchClassifier;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes the {@code xmi:Extension} block Enterprise Architect reads on import:
 * element and connector properties, and the diagram with its object geometry and links.
 */
class EaExtensionWriter {
    private static final String CONNECTOR_END_STYLE = "Union=0;Derived=0;AllowDuplicates=0;";
    private static final String CROSS_LANE_LINK_STYLE = "mode=3;routestyle=1;";

    private static final String DIAGRAM_STYLE = "ShowPrivate=1;ShowProtected=1;ShowPublic=1;HideRelationships=0;"
            + "Locked=0;Border=1;HighlightForeign=1;PackageContents=1;SequenceNotes=0;"
            + "ScalePrintImage=0;PPgs.cx=0;PPgs.cy=0;DocSize.cx=%d;DocSize.cy=%d;"
            + "ShowDetails=0;Orientation=P;Zoom=100;ShowTags=0;OpParams=1;"
            + "VisibleAttributeDetail=0;ShowOpRetType=1;ShowIcons=1;CollabNums=0;"
            + "HideProps=0;ShowReqs=0;ShowCons=0;PaperSize=9;HideParents=0;UseAlias=0;"
            + "HideAtts=0;HideOps=0;HideStereo=0;HideElemStereo=0;ShowTests=0;"
            + "ShowMaint=0;ConnectorNotation=UML 2.1;ExplicitNavigability=0;"
            + "AdvancedElementProps=1;AdvancedFeatureProps=1;AdvancedConnectorProps=1;"
            + "ShowShape=1;";

    private static final String SWIMLANE_STYLE = "locked=false;orientation=1;width=0;inbar=false;names=true;color=-1;"
            + "bold=false;fcol=0;tcol=-1;ofCol=-1;ufCol=-1;hl=0;ufh=0;cls=0;"
            + "SwimlaneFont=lfh:-10,lfw:0,lfi:0,lfu:0,lfs:0,lfface:Calibri,lfe:0,"
            + "lfo:0,lfchar:1,lfop:0,lfcp:0,lfq:0,lfpf=0,lfWidth=0;";

    private final Document doc;
    private final XmiDocumentModel model;
    private final DiagramConfig diagramConfig;
    private final BranchClassifier classifier;
    private final String timestamp;

    EaExtensionWriter(Document doc, XmiDocumentModel model, DiagramConfig diagramConfig,
                      BranchClassifier classifier, String timestamp) {
        this.doc = doc;
        this.model = model;
        this.diagramConfig = diagramConfig;
        this.classifier = classifier;
        this.timestamp = timestamp;
    }

    Element write() {
        Element extension = doc.createElement("xmi:Extension");
        extension.setAttribute("extender", "Enterprise Architect");
        extension.setAttribute("extenderID", "6.5");

        Element packages = append(extension, "packages");
        Element pkg = append(packages, "package");
        pkg.setAttribute("xmi:idref", model.packageId);
        append(pkg, "visibility").setAttribute("value", "public");

        extension.appendChild(elements());
        extension.appendChild(connectors());
        extension.appendChild(diagrams());
        return extension;
    }

    // ------ elements

    private Element elements() {
        Element elements = doc.createElement("elements");

        Element pkg = append(elements, "element");
        pkg.setAttribute("xmi:idref", model.packageId);
        pkg.setAttribute("xmi:type", "uml:Package");
        pkg.setAttribute("name", diagramConfig.packageName);
        pkg.setAttribute("scope", "public");
        Element pkgModel = append(pkg, "model");
        pkgModel.setAttribute("package2", model.packageId.replace("EAPK_", "EAID_"));
        pkgModel.setAttribute("package", model.packageId);
        pkgModel.setAttribute("tpos", "0");
        pkgModel.setAttribute("ea_localid", model.localId(model.packageId));
        pkgModel.setAttribute("ea_eleType", "package");
        Element pkgProperties = append(pkg, "properties");
        pkgProperties.setAttribute("isSpecification", "false");
        pkgProperties.setAttribute("sType", "Package");
        pkgProperties.setAttribute("nType", "0");
        pkgProperties.setAttribute("scope", "public");

        for (Swimlane lane : model.graph.swimlanes()) {
            Element element = append(elements, "element");
            element.setAttribute("xmi:idref", lane.id());
            element.setAttribute("xmi:type", "uml:ActivityPartition");
            element.setAttribute("name", lane.name());
            element.setAttribute("scope", "public");
            Element laneModel = append(element, "model");
            laneModel.setAttribute("package", model.packageId);
            laneModel.setAttribute("tpos", "0");
            laneModel.setAttribute("ea_localid", model.localId(lane.id()));
            laneModel.setAttribute("ea_eleType", "element");
            Element properties = append(element, "properties");
            properties.setAttribute("isSpecification", "false");
            properties.setAttribute("sType", "ActivityPartition");
            properties.setAttribute("nType", "0");
            properties.setAttribute("scope", "public");
        }

        for (FlowNode node : model.graph.nodes()) {
            elements.appendChild(nodeElement(node));
        }
        return elements;
    }

    private Element nodeElement(FlowNode node) {
        String name = model.nameOf(node);
        Element element = doc.createElement("element");
        element.setAttribute("xmi:idref", node.id());
        element.setAttribute("xmi:type", XmiStyles.umlType(node.kind()));
        if (!name.isEmpty()) {
            element.setAttribute("name", name);
        }
        element.setAttribute("scope", "public");

        Element nodeModel = append(element, "model");
        nodeModel.setAttribute("package", model.packageId);
        nodeModel.setAttribute("tpos", "0");
        nodeModel.setAttribute("ea_localid", model.localId(node.id()));
        nodeModel.setAttribute("ea_eleType", "element");
        String owner = model.partitionId(node);
        if (owner != null) {
            nodeModel.setAttribute("owner", owner);
        }

        Element properties = append(element, "properties");
        properties.setAttribute("isSpecification", "false");
        properties.setAttribute("sType", XmiStyles.eaType(node.kind()));
        properties.setAttribute("nType", XmiStyles.eaSubtype(node.kind()));
        properties.setAttribute("scope", "public");
        if (!name.isEmpty()) {
            properties.setAttribute("name", name);
        }

        String notes = null;
        if (node.kind() == NodeKind.NOTE && node.hasLabel()) {
            notes = node.label();
            properties.setAttribute("documentation", notes);
        } else if (node instanceof ActionNode action && action.extraActionTag() != null && !action.extraActionTag().isBlank()) {
            notes = action.extraActionTag().trim();
        }
        if (notes != null) {
            append(element, "notes").setTextContent(notes);
        }
        return element;
    }

    // ------ connectors

    private Element connectors() {
        Element connectors = doc.createElement("connectors");
        int seqno = 0;
        for (ControlFlow edge : model.edges) {
            connectors.appendChild(connector(edge, seqno++));
        }
        return connectors;
    }

    private Element connector(ControlFlow edge, int seqno) {
        FlowNode source = model.graph.node(edge.source());
        FlowNode target = model.graph.node(edge.target());
        String guard = edge.hasGuard() ? edge.guard() : null;
        String localId = model.localId(edge.id());

        Element connector = doc.createElement("connector");
        connector.setAttribute("xmi:idref", edge.id());
        connector.appendChild(connectorEnd("source", source, false));
        connector.appendChild(connectorEnd("target", target, true));

        Element properties = append(connector, "properties");
        properties.setAttribute("ea_type", "ControlFlow");
        properties.setAttribute("stereotype", "");
        properties.setAttribute("direction", "Source -> Destination");
        properties.setAttribute("virtualInheritance", "0");
        if (guard != null) {
            properties.setAttribute("name", guard);
            properties.setAttribute("guard", guard);

            Element labels = append(connector, "labels");
            labels.setAttribute("lb", guard);
            labels.setAttribute("mt", "0");
            labels.setAttribute("ea_localid", localId + "_lbl");
            labels.setAttribute("pt", edge.crossesSwimlane() ? "Center" : "MiddleRight");
        }

        append(connector, "documentation").setAttribute("value", guard == null ? "" : guard);

        Element appearance = append(connector, "appearance");
        appearance.setAttribute("linemode", edge.crossesSwimlane() ? "3" : "1");
        appearance.setAttribute("linecolor", "-1");
        appearance.setAttribute("linewidth", "1");
        appearance.setAttribute("seqno", String.valueOf(seqno));
        appearance.setAttribute("headStyle", "0");
        appearance.setAttribute("lineStyle", "0");
        if (edge.crossesSwimlane()) {
            appearance.setAttribute("routing", "Orthogonal");
            appearance.setAttribute("startPointX", "-1");
            appearance.setAttribute("startPointY", "-1");
            appearance.setAttribute("endPointX", "-1");
            appearance.setAttribute("endPointY", "-1");
        }

        if (guard != null) {
            Element tag = append(append(connector, "tags"), "tag");
            tag.setAttribute("name", "guard");
            tag.setAttribute("value", guard);
            tag.setAttribute("modelElement", edge.id());
        }
        append(connector, "xrefs");

        Element extended = append(connector, "extendedProperties");
        extended.setAttribute("conditional", String.valueOf(guard != null));
        extended.setAttribute("diagram", model.diagramId);
        return connector;
    }

    private Element connectorEnd(String tag, FlowNode node, boolean navigable) {
        Element end = doc.createElement(tag);
        end.setAttribute("xmi:idref", node.id());

        Element endModel = append(end, "model");
        endModel.setAttribute("ea_localid", model.localId(node.id()));
        endModel.setAttribute("type", XmiStyles.eaType(node.kind()));
        endModel.setAttribute("name", model.nameOf(node));

        Element role = append(end, "role");
        role.setAttribute("visibility", "Public");
        role.setAttribute("targetScope", "instance");

        Element type = append(end, "type");
        type.setAttribute("aggregation", "none");
        type.setAttribute("containment", "Unspecified");

        append(end, "constraints");

        Element modifiers = append(end, "modifiers");
        modifiers.setAttribute("isOrdered", "false");
        modifiers.setAttribute("changeable", "none");
        modifiers.setAttribute("isNavigable", String.valueOf(navigable));

        append(end, "style").setAttribute("value", CONNECTOR_END_STYLE);

        if (node.swimlane() != null) {
            append(end, "properties").setAttribute("swimlane", node.swimlane());
        }
        return end;
    }

    // ------ diagram

    private Element diagrams() {
        Element diagrams = doc.createElement("diagrams");
        Element diagram = append(diagrams, "diagram");
        diagram.setAttribute("xmi:id", model.diagramId);
        diagram.setAttribute("name", model.graph.name());
        diagram.setAttribute("type", "Activity");
        diagram.setAttribute("diagramType", "ActivityDiagram");

        String localId = model.localId(model.diagramId);
        Element diagramModel = append(diagram, "model");
        diagramModel.setAttribute("package", model.packageId);
        diagramModel.setAttribute("localID", localId);
        diagramModel.setAttribute("owner", model.packageId);
        diagramModel.setAttribute("ea_localid", localId);
        diagramModel.setAttribute("tpos", "0");

        append(diagram, "style1").setAttribute("value",
                String.format(DIAGRAM_STYLE, model.canvasWidth, model.canvasHeight));
        append(diagram, "swimlanes").setAttribute("value", SWIMLANE_STYLE);

        Element properties = append(diagram, "properties");
        properties.setAttribute("name", model.graph.name());
        properties.setAttribute("type", "Activity");
        properties.setAttribute("documentation", "");

        Element project = append(diagram, "project");
        project.setAttribute("author", diagramConfig.author);
        project.setAttribute("version", diagramConfig.version);
        project.setAttribute("created", timestamp == null ? "" : timestamp);
        project.setAttribute("modified", timestamp == null ? "" : timestamp);

        Element elements = append(diagram, "elements");
        int seqno = 0;
        for (Swimlane lane : model.graph.swimlanes()) {
            SwimlaneBounds bounds = model.laneBounds.get(lane.name());
            Element element = append(elements, "element");
            element.setAttribute("subject", lane.id());
            element.setAttribute("seqno", String.valueOf(seqno++));
            element.setAttribute("geometry", geometry(bounds.left(), bounds.top(), bounds.right(), bounds.bottom()));
            element.setAttribute("style", XmiStyles.LANE_STYLE);
        }
        for (FlowNode node : model.graph.nodes()) {
            NodeGeometry g = model.geometry.get(node.id());
            Element element = append(elements, "element");
            element.setAttribute("subject", node.id());
            element.setAttribute("seqno", String.valueOf(seqno++));
            element.setAttribute("geometry", geometry(g.x(), g.y(), g.right(), g.bottom()));
            element.setAttribute("style", XmiStyles.styleFor(node, classifier));
        }

        Element links = append(diagram, "diagramlinks");
        for (ControlFlow edge : model.edges) {
            Element link = append(links, "diagramlink");
            link.setAttribute("connectorID", edge.id());
            link.setAttribute("hidden", "false");
            append(link, "style").setAttribute("value", edge.crossesSwimlane() ? CROSS_LANE_LINK_STYLE : "");
        }
        return diagrams;
    }

    private static String geometry(int left, int top, int right, int bottom) {
        return "Left=" + left + ";Top=" + top + ";Right=" + right + ";Bottom=" + bottom + ";";
    }

    private Element append(Element parent, String tag) {
        Element child = doc.createElement(tag);
        parent.appendChild(child);
        return child;
    }
}
