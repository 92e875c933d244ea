package org.flowxmi.activity.conversion.diagnostics;

public enum Severity {
    /** Structural warning, the element was repaired or merely noted. */
    WARNING,
    /** Serialization error, the element was left out of the document. */
    ERROR
}
