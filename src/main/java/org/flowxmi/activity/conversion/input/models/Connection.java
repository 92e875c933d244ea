package org.flowxmi.activity.conversion.input.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Connection {
    public String source;
    public String target;
    public String guard; // optional, raw text such as "[yes]" or "approved"

    public Connection() {
    }

    public Connection(String source, String target, String guard) {
        this.source = source;
        this.target = target;
        this.guard = guard;
    }
}
