package dev.ibuilder.display;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON projection of a {@link DisplayNode}, for hosts that render the tree themselves.
 *
 * <p>Composites become {@code {"name": ..., "fields": [...]}} where each field is
 * {@code {"name": ..., "value": ...}} (named) or {@code {"value": ...}} (unnamed); leaves become
 * their text, or {@code null} when missing.
 */
public final class DisplayNodeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DisplayNodeJson() {}

    public static JsonNode toJson(DisplayNode node) {
        if (node instanceof DisplayNode.Leaf leaf) {
            if (leaf.field() instanceof DisplayField.Value value) {
                return MAPPER.getNodeFactory().textNode(value.text());
            }
            return MAPPER.getNodeFactory().nullNode();
        }
        var composite = (DisplayNode.Composite) node;
        ObjectNode object = MAPPER.createObjectNode();
        object.put("name", composite.name());
        ArrayNode fields = object.putArray("fields");
        for (DisplayEntry entry : composite.entries()) {
            ObjectNode field = fields.addObject();
            if (entry instanceof DisplayEntry.Named named) {
                field.put("name", named.name());
            }
            field.set("value", toJson(entry.node()));
        }
        return object;
    }

    public static String toPrettyString(DisplayNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize display tree", e);
        }
    }
}
