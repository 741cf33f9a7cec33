package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.GlobalMirrorVersion;

/**
 * A mirrored dataset version with its row count.
 */
public final class VersionSummary {

    public final String datasetId;
    public final String version;
    public final String checksum;
    public final long ts;
    public final long rowCount;

    public VersionSummary(GlobalMirrorVersion record, long rowCount) {
        this.datasetId = record.datasetId;
        this.version = record.version;
        this.checksum = record.checksum;
        this.ts = record.ts;
        this.rowCount = rowCount;
    }
}
