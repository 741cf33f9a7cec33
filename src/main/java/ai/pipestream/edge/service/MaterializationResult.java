package ai.pipestream.edge.service;

/**
 * Outcome of one materialization run: the dataset version it was pinned to and the number of
 * view rows appended.
 */
public final class MaterializationResult {

    public final String userId;
    public final String datasetId;
    public final String version;
    public final String checksum;
    public final long ts;
    public final int appended;

    public MaterializationResult(String userId, String datasetId, String version, String checksum,
                                 long ts, int appended) {
        this.userId = userId;
        this.datasetId = datasetId;
        this.version = version;
        this.checksum = checksum;
        this.ts = ts;
        this.appended = appended;
    }

    @Override
    public String toString() {
        return userId + "/" + datasetId + "@" + version + " (" + appended + " rows)";
    }
}
