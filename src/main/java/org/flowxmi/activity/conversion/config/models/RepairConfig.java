package org.flowxmi.activity.conversion.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RepairConfig {
    /**
     * Keywords marking a label as the positive outcome of a decision.
     * Example: ["approved", "confirmed", "zatwierdz"]
     */
    public List<String> successKeywords = new ArrayList<>();

    /**
     * Keywords marking a label as the negative outcome of a decision.
     */
    public List<String> failureKeywords = new ArrayList<>();

    /**
     * When false the missing-branch heuristic is switched off and incomplete decisions are only reported.
     */
    public boolean suggestMissingBranches = true;
}
