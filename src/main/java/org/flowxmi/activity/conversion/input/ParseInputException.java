package org.flowxmi.activity.conversion.input;

import java.util.List;

/**
 * Thrown when the activity input is structurally unusable. Fatal for the conversion:
 * no document is produced.
 */
public class ParseInputException extends IllegalArgumentException {
    private final List<String> problems;

    public ParseInputException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public ParseInputException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
