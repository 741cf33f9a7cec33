package ai.pipestream.edge.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Row-level difference between two versions of a dataset.
 * <p>
 * Rows are compared by their canonical JSON text and counted as a multiset: a row stored twice
 * in the older version and once in the newer one shows up once in {@code removed}.
 */
public final class VersionDiff {

    public final String datasetId;
    public final String fromVersion;
    public final String toVersion;
    /** Rows of {@code toVersion} with no counterpart in {@code fromVersion}, in insertion order. */
    public final List<JsonNode> added;
    /** Rows of {@code fromVersion} with no counterpart in {@code toVersion}, in insertion order. */
    public final List<JsonNode> removed;
    public final long unchanged;

    public VersionDiff(String datasetId, String fromVersion, String toVersion,
                       List<JsonNode> added, List<JsonNode> removed, long unchanged) {
        this.datasetId = datasetId;
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
        this.added = List.copyOf(added);
        this.removed = List.copyOf(removed);
        this.unchanged = unchanged;
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }

    @Override
    public String toString() {
        return datasetId + " " + fromVersion + ".." + toVersion + ": +" + added.size() + " -" + removed.size();
    }
}
