package ai.pipestream.edge.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Derives personalized view items from mirrored dataset rows.
 * <p>
 * Implementations are discovered as CDI beans, or registered per dataset on
 * {@link ViewTransformRegistry}. They run inside the materialization transaction and must not
 * write to the store themselves.
 */
public interface ViewTransform {

    /**
     * @return true if this transform handles rows of {@code datasetId}
     */
    boolean appliesTo(String datasetId);

    /**
     * Derive the view item for one row.
     *
     * @param row mirrored row, owned by the caller for this call only
     * @param ctx the user's context for the dataset, empty when none is stored
     * @return the derived item, or null to leave the row out of the view
     */
    JsonNode derive(JsonNode row, ObjectNode ctx);
}
