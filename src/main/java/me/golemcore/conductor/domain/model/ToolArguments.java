package me.golemcore.conductor.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over the merged arguments handed to a tool. Values are JSON
 * trees, so every accessor matches on the node type instead of casting.
 */
public final class ToolArguments {

    public static final String TOOL_CALL_ID = "_tool_call_id";
    public static final String CONVERSATION_ID = "_conversation_id";

    private final ObjectNode node;

    public ToolArguments(ObjectNode node) {
        this.node = node != null ? node.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public static ToolArguments empty() {
        return new ToolArguments(null);
    }

    public ObjectNode asObjectNode() {
        return node.deepCopy();
    }

    public boolean has(String name) {
        return node.has(name) && !node.get(name).isNull();
    }

    public Optional<JsonNode> get(String name) {
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Returns the textual form of a scalar argument. Objects and arrays are
     * rendered as compact JSON.
     */
    public Optional<String> getString(String name) {
        return get(name).map(ToolArguments::scalarText);
    }

    public String requireString(String name) {
        return getString(name)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalArgumentException("Missing '" + name + "' argument"));
    }

    public Optional<Double> getNumber(String name) {
        return get(name).flatMap(value -> switch (value.getNodeType()) {
        case NUMBER -> Optional.of(value.asDouble());
        case STRING -> parseDouble(value.asText());
        case BOOLEAN, OBJECT, ARRAY, NULL, MISSING, BINARY, POJO -> Optional.empty();
        });
    }

    public Optional<Boolean> getBoolean(String name) {
        return get(name).flatMap(value -> switch (value.getNodeType()) {
        case BOOLEAN -> Optional.of(value.asBoolean());
        case STRING -> "true".equalsIgnoreCase(value.asText().trim())
                ? Optional.of(Boolean.TRUE)
                : "false".equalsIgnoreCase(value.asText().trim()) ? Optional.of(Boolean.FALSE) : Optional.empty();
        case NUMBER, OBJECT, ARRAY, NULL, MISSING, BINARY, POJO -> Optional.empty();
        });
    }

    /**
     * Returns the elements of an array argument as text. A scalar is treated as a
     * single-element list.
     */
    public List<String> getStringList(String name) {
        List<String> values = new ArrayList<>();
        get(name).ifPresent(value -> {
            if (value.isArray()) {
                Iterator<JsonNode> elements = value.elements();
                while (elements.hasNext()) {
                    values.add(scalarText(elements.next()));
                }
            } else {
                values.add(scalarText(value));
            }
        });
        return values;
    }

    public Iterator<String> names() {
        return node.fieldNames();
    }

    private static String scalarText(JsonNode value) {
        return switch (value.getNodeType()) {
        case STRING -> value.textValue();
        case NUMBER, BOOLEAN -> value.asText();
        case OBJECT, ARRAY, POJO, BINARY -> value.toString();
        case NULL, MISSING -> "";
        };
    }

    private static Optional<Double> parseDouble(String text) {
        try {
            return Optional.of(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
