package ai.pipestream.edge.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Jackson helpers for the JSON text stored in item, ctx and document columns.
 * <p>
 * Parsing and serialization failures are rethrown as {@link IllegalArgumentException} so that
 * services can report them as invalid input rather than storage failures.
 */
public final class JsonDocuments {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private JsonDocuments() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes a JSON tree to compact text.
     *
     * @param node tree to serialize; {@code null} is written as JSON {@code null}
     * @return JSON text suitable for database storage
     */
    public static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node == null ? MAPPER.nullNode() : node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON document", e);
        }
    }

    /**
     * Serializes a JSON tree with object members sorted by name at every level, so documents that
     * differ only in member order produce the same text.
     */
    public static String canonicalJson(JsonNode node) {
        try {
            Object plain = MAPPER.treeToValue(node == null ? MAPPER.nullNode() : node, Object.class);
            return CANONICAL.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON document", e);
        }
    }

    /**
     * Parses stored JSON text.
     *
     * @param json JSON text; null or empty yields an empty object
     * @return parsed tree
     */
    public static JsonNode parse(String json) {
        if (json == null || json.isEmpty()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON document", e);
        }
    }

    /**
     * Parses JSON text that must hold an object.
     */
    public static ObjectNode parseObject(String json) {
        JsonNode node = parse(json);
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object but found " + node.getNodeType());
        }
        return (ObjectNode) node;
    }

    /**
     * Converts a plain Java value (maps, lists, scalars) into a JSON tree.
     */
    public static JsonNode valueToTree(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return MAPPER.valueToTree(value);
    }

    /**
     * JSON value equality where numbers compare by numeric value ({@code 1 == 1.0}).
     */
    public static boolean sameValue(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }
}
