package ai.pipestream.edge.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;

/**
 * A compiled, definite JSON path such as {@code $.a.b[0].c} or {@code $['a']['b']}, evaluated
 * with Jayway JsonPath directly against Jackson trees.
 * <p>
 * Paths must start at the root {@code $} and select at most one value: deep scans, wildcards,
 * slices and filters are rejected at compile time.
 */
public final class JsonPath {

    private static final Configuration JACKSON_CONFIG = Configuration.builder()
        .jsonProvider(new JacksonJsonNodeJsonProvider(JsonDocuments.mapper()))
        .mappingProvider(new JacksonMappingProvider(JsonDocuments.mapper()))
        .build();

    private final String expression;
    private final com.jayway.jsonpath.JsonPath compiled;

    private JsonPath(String expression, com.jayway.jsonpath.JsonPath compiled) {
        this.expression = expression;
        this.compiled = compiled;
    }

    /**
     * Compiles a path expression.
     *
     * @param expression path starting with {@code $}
     * @return compiled path
     * @throws IllegalArgumentException if the expression is malformed or can select more than one value
     */
    public static JsonPath compile(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("JSON path is required");
        }
        String expr = expression.trim();
        // Jayway would silently anchor a relative path at the root
        if (expr.charAt(0) != '$') {
            throw new IllegalArgumentException("JSON path must start with '$': " + expression);
        }
        com.jayway.jsonpath.JsonPath compiled;
        try {
            compiled = com.jayway.jsonpath.JsonPath.compile(expr);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Malformed JSON path " + expression + ": " + e.getMessage(), e);
        }
        if (!compiled.isDefinite()) {
            throw new IllegalArgumentException("JSON path must select a single value: " + expression);
        }
        return new JsonPath(expr, compiled);
    }

    /**
     * Compiles either a full path or a bare top-level field name ({@code status} is read as
     * {@code $.status}).
     */
    public static JsonPath fromFieldOrPath(String fieldOrPath) {
        if (fieldOrPath != null && !fieldOrPath.isBlank() && fieldOrPath.trim().charAt(0) != '$') {
            return compile("$." + fieldOrPath.trim());
        }
        return compile(fieldOrPath);
    }

    /**
     * Reads the value at this path.
     *
     * @param root document root
     * @return the value, or a {@link MissingNode} when any step does not resolve
     */
    public JsonNode read(JsonNode root) {
        if (root == null || root.isMissingNode()) {
            return MissingNode.getInstance();
        }
        Object value;
        try {
            value = compiled.read(root, JACKSON_CONFIG);
        } catch (PathNotFoundException e) {
            return MissingNode.getInstance();
        }
        // scalar leaves come back unwrapped to plain Java values
        return JsonDocuments.valueToTree(value);
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
