package ai.pipestream.edge.service;

import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Default view transform.
 * <p>
 * Context keys:
 * <ul>
 *   <li>{@code filters}: object of field to expected value; a row is kept only if every field
 *       equals its value, or is one of the values when the expected value is an array</li>
 *   <li>{@code selection}: array of field names; when present only those row fields are kept</li>
 *   <li>{@code sort}: {@code {"by": field, "desc": bool}}, applied by the materializer</li>
 * </ul>
 * Every other context field is copied onto each kept row, replacing a row field of the same name.
 */
public class ContextOverlayTransform implements ViewTransform {

    public static final Set<String> RESERVED_KEYS = Set.of("filters", "sort", "selection");

    @Override
    public boolean appliesTo(String datasetId) {
        return true;
    }

    @Override
    public JsonNode derive(JsonNode row, ObjectNode ctx) {
        if (!matchesFilters(row, ctx.path("filters"))) {
            return null;
        }
        if (!row.isObject()) {
            return row;
        }
        ObjectNode item = select((ObjectNode) row, ctx.path("selection"));
        Iterator<Map.Entry<String, JsonNode>> fields = ctx.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!RESERVED_KEYS.contains(field.getKey())) {
                item.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return item;
    }

    static boolean matchesFilters(JsonNode row, JsonNode filters) {
        if (!filters.isObject()) {
            return true;
        }
        Iterator<Map.Entry<String, JsonNode>> it = filters.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> filter = it.next();
            JsonNode actual = row.path(filter.getKey());
            if (actual instanceof MissingNode) {
                actual = NullNode.getInstance();
            }
            if (!accepts(filter.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    private static boolean accepts(JsonNode expected, JsonNode actual) {
        if (!expected.isArray()) {
            return JsonDocuments.sameValue(expected, actual);
        }
        for (JsonNode candidate : expected) {
            if (JsonDocuments.sameValue(candidate, actual)) {
                return true;
            }
        }
        return false;
    }

    private static ObjectNode select(ObjectNode row, JsonNode selection) {
        if (!selection.isArray() || selection.isEmpty()) {
            return row.deepCopy();
        }
        ObjectNode selected = JsonDocuments.mapper().createObjectNode();
        for (JsonNode name : selection) {
            JsonNode value = row.get(name.asText());
            if (value != null) {
                selected.set(name.asText(), value.deepCopy());
            }
        }
        return selected;
    }
}
