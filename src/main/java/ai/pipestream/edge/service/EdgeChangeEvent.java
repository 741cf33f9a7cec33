package ai.pipestream.edge.service;

/**
 * Change notification fired as a CDI event after the corresponding transaction commits.
 * <p>
 * Observers receive events synchronously on the caller's thread; an observer failure does not
 * undo the committed change.
 */
public class EdgeChangeEvent {

    public enum Type {
        MIRROR_PUBLISHED,
        VIEW_MATERIALIZED,
        DOCUMENT_UPSERTED,
        DOCUMENT_DELETED,
        TABLE_DROPPED
    }

    public final Type type;

    /**
     * Tenant for view and UserDB events; null for mirror events.
     */
    public final String userId;

    /**
     * Dataset id for mirror and view events, logical table name for UserDB events.
     */
    public final String subject;

    /**
     * Dataset version for mirror and view events, primary key for document events.
     */
    public final String key;

    /**
     * Rows published or appended; 1 for document events.
     */
    public final long count;

    public EdgeChangeEvent(Type type, String userId, String subject, String key, long count) {
        this.type = type;
        this.userId = userId;
        this.subject = subject;
        this.key = key;
        this.count = count;
    }

    public static EdgeChangeEvent mirrorPublished(String datasetId, String version, long rows) {
        return new EdgeChangeEvent(Type.MIRROR_PUBLISHED, null, datasetId, version, rows);
    }

    public static EdgeChangeEvent viewMaterialized(String userId, String datasetId, String version, long rows) {
        return new EdgeChangeEvent(Type.VIEW_MATERIALIZED, userId, datasetId, version, rows);
    }

    public static EdgeChangeEvent documentUpserted(String userId, String tableName, String pk) {
        return new EdgeChangeEvent(Type.DOCUMENT_UPSERTED, userId, tableName, pk, 1);
    }

    public static EdgeChangeEvent documentDeleted(String userId, String tableName, String pk) {
        return new EdgeChangeEvent(Type.DOCUMENT_DELETED, userId, tableName, pk, 1);
    }

    public static EdgeChangeEvent tableDropped(String userId, String tableName, long documents) {
        return new EdgeChangeEvent(Type.TABLE_DROPPED, userId, tableName, null, documents);
    }

    @Override
    public String toString() {
        return type + "{userId=" + userId + ", subject=" + subject + ", key=" + key + ", count=" + count + "}";
    }
}
