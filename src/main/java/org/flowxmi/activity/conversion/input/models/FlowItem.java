package org.flowxmi.activity.conversion.input.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One node as delivered by the upstream parser.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowItem {
    /**
     * Input-local id, referenced by connections and by notes' attachedTo.
     */
    public String id;

    /**
     * Node kind, e.g. "Initial", "Action", "Decision" (see NodeKind for accepted spellings).
     */
    public String kind;
    public String label;
    public String swimlane;

    // Action only
    public String color;
    public String extraActionTag;

    // Note only
    public String attachedTo;

    public FlowItem() {
    }

    public FlowItem(String id, String kind, String label, String swimlane) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.swimlane = swimlane;
    }
}
