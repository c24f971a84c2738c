package dev.ibuilder.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ibuilder.model.Input;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads scripts of user inputs from JSON, so that a session can be replayed without a console.
 *
 * <pre>
 * [
 *   {"choice": "integer"},
 *   {"text": "42"},
 *   {"choice": "__finalize"}
 * ]
 * </pre>
 */
public final class InputScriptLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InputScriptLoader() {}

    /**
     * Load a script from a JSON file.
     */
    public static List<Input> loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseScript(root);
    }

    /**
     * Load a script from a JSON string.
     */
    public static List<Input> loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseScript(root);
    }

    private static List<Input> parseScript(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Input script must be a JSON array");
        }
        var inputs = new ArrayList<Input>();
        for (JsonNode entry : root) {
            inputs.add(parseInput(entry));
        }
        return inputs;
    }

    private static Input parseInput(JsonNode node) {
        if (node.has("choice") && !node.has("text")) {
            return new Input.Choice(node.get("choice").asText());
        } else if (node.has("text") && !node.has("choice")) {
            return new Input.Text(node.get("text").asText());
        }
        throw new IllegalArgumentException("Unknown input format: " + node);
    }
}
