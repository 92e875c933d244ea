package org.flowxmi.activity.conversion.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DiagramConfig {
    /**
     * Name of the UML package that owns the activity.
     */
    public String packageName = "Activities";
    public String author = "activity-xmi-converter";
    public String version = "1.0";

    /**
     * When true, action names are prefixed with a running number ("K01. Review order").
     */
    public boolean numberActions = false;
    public String actionNumberPrefix = "K";
}
