package org.flowxmi.activity.conversion.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one conversion in the order they were raised.
 * Not thread-safe; each conversion owns its own sink.
 */
public class Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(DiagnosticCode code, String elementId, String message) {
        Diagnostic diagnostic = new Diagnostic(code, elementId, message);
        entries.add(diagnostic);
        if (code.severity() == Severity.ERROR) {
            log.error("{}", diagnostic);
        } else {
            log.warn("{}", diagnostic);
        }
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return entries.stream()
                .filter(d -> d.code() == code)
                .toList();
    }

    public boolean has(DiagnosticCode code) {
        return entries.stream().anyMatch(d -> d.code() == code);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
