package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.UserDocument;
import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Documents matched by a UserDB query, with the access path that produced them.
 */
public final class QueryResult {

    public enum AccessPath {
        /** Resolved through a declared secondary index. */
        INDEX,
        /** No index on the column: every document of the table was read. */
        FULL_SCAN
    }

    public final AccessPath accessPath;

    /**
     * Matching documents ordered by primary key.
     */
    public final List<UserDocument> documents;

    /**
     * Index entries (INDEX) or documents (FULL_SCAN) examined to produce the result.
     */
    public final long examined;

    public QueryResult(AccessPath accessPath, List<UserDocument> documents, long examined) {
        this.accessPath = accessPath;
        this.documents = Collections.unmodifiableList(documents);
        this.examined = examined;
    }

    public boolean isIndexed() {
        return accessPath == AccessPath.INDEX;
    }

    public List<String> primaryKeys() {
        List<String> pks = new ArrayList<>(documents.size());
        for (UserDocument document : documents) {
            pks.add(document.pk);
        }
        return pks;
    }

    public List<JsonNode> items() {
        List<JsonNode> items = new ArrayList<>(documents.size());
        for (UserDocument document : documents) {
            items.add(JsonDocuments.parse(document.item));
        }
        return items;
    }
}
