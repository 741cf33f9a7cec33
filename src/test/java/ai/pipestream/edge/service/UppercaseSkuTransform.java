package ai.pipestream.edge.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Transform bean used by the tests for datasets named {@code upper-*}.
 */
@ApplicationScoped
public class UppercaseSkuTransform implements ViewTransform {

    @Override
    public boolean appliesTo(String datasetId) {
        return datasetId.startsWith("upper-");
    }

    @Override
    public JsonNode derive(JsonNode row, ObjectNode ctx) {
        ObjectNode item = row.deepCopy();
        item.put("sku", row.path("sku").asText().toUpperCase());
        return item;
    }
}
