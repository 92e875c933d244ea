package org.flowxmi.activity.conversion.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.flowxmi.activity.conversion.input.models.ActivityInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

public class ActivityInputHelper {
    private static final Logger log = LoggerFactory.getLogger(ActivityInputHelper.class);

    public static final String SCHEMA_RESOURCE_PATH = "schemas/activity-input.schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static JsonSchema schema;

    /**
     * Loads, schema-validates and maps an activity input JSON file.
     *
     * @param inputFilePath path to the JSON file
     * @return the validated input
     * @throws ParseInputException if the file cannot be read or is not a valid activity input
     */
    public static ActivityInput loadInputFile(String inputFilePath) {
        Path path = Paths.get(inputFilePath);
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new ParseInputException("Failed to read activity input: " + inputFilePath, e);
        }
        return parseInput(json);
    }

    /**
     * Parses an activity input from its JSON text.
     *
     * @param json the JSON document
     * @return the validated input
     * @throws ParseInputException if the text is not JSON, violates the schema or fails structural validation
     */
    public static ActivityInput parseInput(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParseInputException("Activity input is not valid JSON", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new ParseInputException("Activity input is empty", List.of());
        }

        Set<ValidationMessage> messages = validateAgainstSchema(node);
        if (!messages.isEmpty()) {
            List<String> problems = messages.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted(Comparator.naturalOrder())
                    .toList();
            log.debug("Activity input violates schema: {}", problems);
            throw new ParseInputException("Activity input violates schema", problems);
        }

        ActivityInput input;
        try {
            input = mapper.treeToValue(node, ActivityInput.class);
        } catch (JsonProcessingException e) {
            throw new ParseInputException("Failed to map activity input", e);
        }

        ActivityInputValidator.validate(input);
        log.info("Activity input '{}' loaded: {} flow items, {} connections, {} swimlanes",
                input.diagramName,
                input.flow.size(),
                input.connections == null ? 0 : input.connections.size(),
                input.swimlanes == null ? 0 : input.swimlanes.size());
        return input;
    }

    /**
     * Validates a JSON tree against the bundled activity input schema.
     *
     * @param node the parsed JSON
     * @return the schema violations, empty when the document conforms
     */
    public static Set<ValidationMessage> validateAgainstSchema(JsonNode node) {
        return loadSchema().validate(node);
    }

    private static synchronized JsonSchema loadSchema() {
        if (schema != null) {
            return schema;
        }
        ClassLoader cl = ActivityInputHelper.class.getClassLoader();
        try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load schema: " + SCHEMA_RESOURCE_PATH, e);
        }
    }
}
