package org.flowxmi.activity.conversion.xmi;

import org.flowxmi.activity.conversion.graph.GuardLabels;
import org.flowxmi.activity.conversion.graph.models.ActionNode;
import org.flowxmi.activity.conversion.graph.models.FlowNode;
import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.repair.BranchClassifier;

import java.util.Locale;
import java.util.Map;

/**
 * Enterprise Architect vocabulary per node kind: UML metaclass, EA element type, EA subtype
 * code and diagram style string.
 * EA colors are BGR integers (blue in the high byte).
 */
public class XmiStyles {
    public static final String LANE_STYLE = "LineColor=15461355;FillColor=14993154;LineWidth=1;BorderStyle=0;VPartition=1;";

    private static final String BASE_STYLE = "BorderColor=-1;BorderWidth=-1;";
    private static final int ACTION_COLOR = 13434828;
    private static final int SUCCESS_COLOR = 8454143;
    private static final int FAILURE_COLOR = 5263615;

    private static final Map<String, Integer> NAMED_COLORS = Map.of(
            "green", SUCCESS_COLOR,
            "success", SUCCESS_COLOR,
            "red", FAILURE_COLOR,
            "failure", FAILURE_COLOR,
            "error", FAILURE_COLOR,
            "orange", 42495,
            "yellow", 65535,
            "blue", 16744448,
            "white", 16777215,
            "gray", 12632256
    );

    public static String umlType(NodeKind kind) {
        return switch (kind) {
            case INITIAL -> "uml:InitialNode";
            case FINAL -> "uml:ActivityFinalNode";
            case ACTION -> "uml:Action";
            case DECISION -> "uml:DecisionNode";
            case MERGE -> "uml:MergeNode";
            case FORK -> "uml:ForkNode";
            case JOIN -> "uml:JoinNode";
            case NOTE -> "uml:Comment";
        };
    }

    public static String eaType(NodeKind kind) {
        return switch (kind) {
            case INITIAL, FINAL -> "StateNode";
            case ACTION -> "Action";
            case DECISION -> "Decision";
            case MERGE -> "Merge";
            case FORK, JOIN -> "Synchronization";
            case NOTE -> "Note";
        };
    }

    public static String eaSubtype(NodeKind kind) {
        return switch (kind) {
            case INITIAL -> "100";
            case FINAL -> "101";
            case DECISION -> "131";
            case MERGE -> "133";
            default -> "0";
        };
    }

    /**
     * Diagram object style for a node. Actions are filled from their color tag when present,
     * otherwise green for success-like labels and red for failure-like ones.
     */
    public static String styleFor(FlowNode node, BranchClassifier classifier) {
        return BASE_STYLE + switch (node.kind()) {
            case INITIAL -> "BColor=0;FontColor=-1;BorderWidth=0;Shape=Circle;";
            case FINAL -> "BColor=0;FontColor=-1;BorderWidth=1;Shape=Circle;";
            case DECISION, MERGE -> "BColor=16777062;FontColor=-1;Shape=Diamond;";
            case FORK, JOIN -> "BColor=0;FontColor=-1;LineWidth=3;Shape=Rectangle;";
            case NOTE -> "BColor=16777215;FontColor=-1;BorderStyle=Dashed;";
            case ACTION -> "BColor=" + actionColor((ActionNode) node, classifier) + ";FontColor=-1;BorderRadius=10;";
        };
    }

    static int actionColor(ActionNode action, BranchClassifier classifier) {
        Integer tagged = parseColor(action.color());
        if (tagged != null) {
            return tagged;
        }
        String outcome = classifier == null ? null : classifier.classify(action.label());
        if (GuardLabels.YES.equals(outcome)) {
            return SUCCESS_COLOR;
        }
        if (GuardLabels.NO.equals(outcome)) {
            return FAILURE_COLOR;
        }
        return ACTION_COLOR;
    }

    /**
     * Parses a color tag: a known color name or {@code #RRGGBB}.
     *
     * @return the EA (BGR) color value, or null when the tag is absent or unknown
     */
    static Integer parseColor(String tag) {
        if (tag == null || tag.isBlank()) {
            return null;
        }
        String value = tag.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("#") && value.length() == 7) {
            try {
                int rgb = Integer.parseInt(value.substring(1), 16);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                return (b << 16) | (g << 8) | r;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return NAMED_COLORS.get(value);
    }
}
