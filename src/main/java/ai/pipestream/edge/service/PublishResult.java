package ai.pipestream.edge.service;

/**
 * Outcome of publishing a dataset version.
 */
public final class PublishResult {

    public final String datasetId;
    public final String version;
    public final String checksum;
    public final long ts;
    public final long rowCount;

    /**
     * False when the same version and checksum were already stored and nothing was written.
     */
    public final boolean created;

    public PublishResult(String datasetId, String version, String checksum, long ts, long rowCount, boolean created) {
        this.datasetId = datasetId;
        this.version = version;
        this.checksum = checksum;
        this.ts = ts;
        this.rowCount = rowCount;
        this.created = created;
    }

    @Override
    public String toString() {
        return datasetId + "/" + version + " (" + rowCount + " rows, created=" + created + ")";
    }
}
