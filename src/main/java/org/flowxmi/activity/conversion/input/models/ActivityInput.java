package org.flowxmi.activity.conversion.input.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of an already-parsed activity description.
 * Example: {"diagramName": "Order", "swimlanes": ["Customer"], "flow": [...], "connections": [...]}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActivityInput {
    public String diagramName;

    /**
     * Declared swimlane names, in display order.
     */
    public List<String> swimlanes = new ArrayList<>();

    /**
     * Flow items in source order.
     */
    public List<FlowItem> flow = new ArrayList<>();

    public List<Connection> connections = new ArrayList<>();

    public ActivityInput() {
    }

    public ActivityInput(String diagramName, List<String> swimlanes, List<FlowItem> flow, List<Connection> connections) {
        this.diagramName = diagramName;
        this.swimlanes = swimlanes;
        this.flow = flow;
        this.connections = connections;
    }
}
