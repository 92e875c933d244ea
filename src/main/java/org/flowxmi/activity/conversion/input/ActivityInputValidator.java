package org.flowxmi.activity.conversion.input;

import org.flowxmi.activity.conversion.graph.models.NodeKind;
import org.flowxmi.activity.conversion.input.models.ActivityInput;
import org.flowxmi.activity.conversion.input.models.Connection;
import org.flowxmi.activity.conversion.input.models.FlowItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on an {@link ActivityInput}, whether it came from JSON or was built in code.
 * References to unknown flow items are not checked here; the graph builder drops those with a warning.
 */
public class ActivityInputValidator {

    /**
     * Validates the input and collects every problem found.
     *
     * @param input the activity input
     * @throws ParseInputException if any required field is missing or malformed
     */
    public static void validate(ActivityInput input) {
        if (input == null) {
            throw new ParseInputException("Activity input is missing", List.of());
        }

        List<String> problems = new ArrayList<>();

        if (input.flow == null || input.flow.isEmpty()) {
            problems.add("'flow' must contain at least one item");
        } else {
            Set<String> seenIds = new HashSet<>();
            for (int i = 0; i < input.flow.size(); i++) {
                FlowItem item = input.flow.get(i);
                String where = "flow[" + i + "]";
                if (item == null) {
                    problems.add(where + " is null");
                    continue;
                }
                if (item.id == null || item.id.isBlank()) {
                    problems.add(where + " has no id");
                } else if (!seenIds.add(item.id)) {
                    problems.add(where + " repeats id '" + item.id + "'");
                }
                if (item.kind == null || item.kind.isBlank()) {
                    problems.add(where + " has no kind");
                } else if (NodeKind.parse(item.kind).isEmpty()) {
                    problems.add(where + " has unknown kind '" + item.kind + "'");
                }
            }
        }

        if (input.connections != null) {
            for (int i = 0; i < input.connections.size(); i++) {
                Connection connection = input.connections.get(i);
                String where = "connections[" + i + "]";
                if (connection == null) {
                    problems.add(where + " is null");
                    continue;
                }
                if (connection.source == null || connection.source.isBlank()) {
                    problems.add(where + " has no source");
                }
                if (connection.target == null || connection.target.isBlank()) {
                    problems.add(where + " has no target");
                }
            }
        }

        if (input.swimlanes != null && input.swimlanes.stream().anyMatch(s -> s == null || s.isBlank())) {
            problems.add("'swimlanes' contains a blank name");
        }

        if (!problems.isEmpty()) {
            throw new ParseInputException("Activity input is invalid", problems);
        }
    }
}
