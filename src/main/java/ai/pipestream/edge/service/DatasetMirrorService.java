package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.GlobalMirrorVersion;
import ai.pipestream.edge.repository.GlobalMirrorRepository;
import ai.pipestream.edge.util.Checksums;
import ai.pipestream.edge.util.JsonDocuments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Local mirror of versioned global datasets.
 * <p>
 * A version is published once with its full row batch and never changes afterwards. Publishing
 * is idempotent on (dataset, version, checksum): a repeat with the same checksum is a no-op, a
 * repeat with a different checksum is refused with {@link ErrorKind#CHECKSUM_MISMATCH}. The latest
 * version is derived on every read (greatest ts, then latest insert), never stored.
 */
@ApplicationScoped
public class DatasetMirrorService {

    private static final Logger LOG = Logger.getLogger(DatasetMirrorService.class);

    @Inject
    GlobalMirrorRepository mirrorRepository;

    @Inject
    TransactionRunner transactions;

    @Inject
    AccessGuard accessGuard;

    @Inject
    ChangeEventPublisher events;

    @Inject
    Clock clock;

    @ConfigProperty(name = "edge.mirror.row-page-size", defaultValue = "500")
    int rowPageSize;

    /**
     * Publish rows under a version derived from their content:
     * {@code checksum = sha256(rows as JSON)}, {@code ts = now} and
     * {@code version = "v{ts}.{first 8 chars of checksum}"}.
     */
    public PublishResult publish(Capability capability, String datasetId, List<? extends JsonNode> rows) {
        accessGuard.checkWrite(capability, "publish");
        if (rows == null) {
            throw EdgeStoreException.invalidArgument("rows are required");
        }
        ArrayNode array = JsonDocuments.mapper().createArrayNode();
        array.addAll(rows);
        String checksum = Checksums.sha256Hex(JsonDocuments.toJson(array));
        long ts = clock.instant().getEpochSecond();
        String version = "v" + ts + "." + checksum.substring(0, 8);
        return publishVersion(capability, datasetId, version, checksum, rows, ts, null);
    }

    public PublishResult publishVersion(Capability capability, String datasetId, String version, String checksum,
                                        List<? extends JsonNode> rows, long ts) {
        return publishVersion(capability, datasetId, version, checksum, rows, ts, null);
    }

    /**
     * Store a dataset version and all of its rows in one transaction.
     *
     * @param timeout transaction timeout, or null for {@code edge.tx.timeout-seconds}
     * @return the stored version; {@code created} is false for an idempotent republish
     * @throws EdgeStoreException CHECKSUM_MISMATCH if the version exists with another checksum,
     *                            DUPLICATE_VERSION if a concurrent publisher stored it first,
     *                            TRANSACTION_ABORTED if the transaction failed or timed out
     */
    public PublishResult publishVersion(Capability capability, String datasetId, String version, String checksum,
                                        List<? extends JsonNode> rows, long ts, Duration timeout) {
        accessGuard.checkWrite(capability, "publishVersion");
        requireText(datasetId, "datasetId");
        requireText(version, "version");
        requireText(checksum, "checksum");
        if (rows == null) {
            throw EdgeStoreException.invalidArgument("rows are required");
        }
        List<String> rowsJson = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            rowsJson.add(JsonDocuments.toJson(row));
        }

        PublishResult result;
        try {
            result = transactions.inTransaction("publishVersion " + datasetId + "/" + version, timeout, () -> {
                GlobalMirrorVersion existing = mirrorRepository.findVersion(datasetId, version);
                if (existing != null) {
                    if (!existing.checksum.equals(checksum)) {
                        throw new EdgeStoreException(ErrorKind.CHECKSUM_MISMATCH, "Version " + datasetId + "/"
                            + version + " is stored with checksum " + existing.checksum + ", not " + checksum);
                    }
                    return new PublishResult(datasetId, version, checksum, existing.ts,
                        mirrorRepository.countRows(datasetId, version), false);
                }
                mirrorRepository.insertVersion(datasetId, version, checksum, ts, rowsJson);
                return new PublishResult(datasetId, version, checksum, ts, rowsJson.size(), true);
            });
        } catch (EdgeStoreException e) {
            if (e.kind() == ErrorKind.TRANSACTION_ABORTED && TransactionRunner.isConstraintViolation(e)) {
                LOG.warnf("Lost publish race for %s/%s", datasetId, version);
                throw new EdgeStoreException(ErrorKind.DUPLICATE_VERSION,
                    "Version " + datasetId + "/" + version + " was published concurrently", e);
            }
            if (e.kind() == ErrorKind.CHECKSUM_MISMATCH) {
                LOG.warnf("Refused republish of %s/%s: %s", datasetId, version, e.getMessage());
            }
            throw e;
        }

        if (result.created) {
            LOG.infof("Published %s/%s with %d rows (ts %d)", datasetId, version, result.rowCount, ts);
            events.publish(EdgeChangeEvent.mirrorPublished(datasetId, version, result.rowCount));
        } else {
            LOG.infof("Version %s/%s already present with the same checksum, nothing to do", datasetId, version);
        }
        return result;
    }

    /**
     * @throws EdgeStoreException NOT_FOUND if the dataset has no version
     */
    public GlobalMirrorVersion getLatestVersion(Capability capability, String datasetId) {
        accessGuard.checkRead(capability, "getLatestVersion");
        GlobalMirrorVersion latest = mirrorRepository.findLatestVersion(datasetId);
        if (latest == null) {
            throw EdgeStoreException.notFound("Dataset " + datasetId + " has no published version");
        }
        return latest;
    }

    public GlobalMirrorVersion getVersion(Capability capability, String datasetId, String version) {
        accessGuard.checkRead(capability, "getVersion");
        return requireVersion(datasetId, version);
    }

    /**
     * Versions newest first.
     *
     * @param limit maximum number of versions (0 = no limit)
     */
    public List<VersionSummary> listVersions(Capability capability, String datasetId, int limit) {
        accessGuard.checkRead(capability, "listVersions");
        if (limit < 0) {
            throw EdgeStoreException.invalidArgument("Limit must not be negative: " + limit);
        }
        List<VersionSummary> summaries = new ArrayList<>();
        for (GlobalMirrorVersion record : mirrorRepository.listVersions(datasetId, limit)) {
            summaries.add(new VersionSummary(record, mirrorRepository.countRows(datasetId, record.version)));
        }
        return summaries;
    }

    /**
     * Rows of a version in insertion order. The returned sequence is lazy and restartable; the
     * version's existence is checked now, rows are read as the sequence is iterated.
     *
     * @throws EdgeStoreException NOT_FOUND if the version does not exist
     */
    public RowSequence getRows(Capability capability, String datasetId, String version) {
        accessGuard.checkRead(capability, "getRows");
        requireVersion(datasetId, version);
        LOG.debugf("Streaming rows of %s/%s in pages of %d", datasetId, version, rowPageSize);
        return new RowSequence(mirrorRepository, datasetId, version, rowPageSize);
    }

    /**
     * Rows added and removed between two versions of a dataset. Either version may be the older
     * one; the diff always reads as the change from {@code fromVersion} to {@code toVersion}.
     * The canonical text of every row in {@code toVersion} is held in memory while comparing.
     *
     * @throws EdgeStoreException NOT_FOUND if either version does not exist
     */
    public VersionDiff getVersionDiff(Capability capability, String datasetId, String fromVersion, String toVersion) {
        accessGuard.checkRead(capability, "getVersionDiff");
        requireVersion(datasetId, fromVersion);
        requireVersion(datasetId, toVersion);
        RowSequence fromRows = new RowSequence(mirrorRepository, datasetId, fromVersion, rowPageSize);
        RowSequence toRows = new RowSequence(mirrorRepository, datasetId, toVersion, rowPageSize);

        Map<String, Integer> unmatched = new HashMap<>();
        for (JsonNode row : toRows) {
            unmatched.merge(JsonDocuments.canonicalJson(row), 1, Integer::sum);
        }
        List<JsonNode> removed = new ArrayList<>();
        long unchanged = 0;
        for (JsonNode row : fromRows) {
            if (take(unmatched, JsonDocuments.canonicalJson(row))) {
                unchanged++;
            } else {
                removed.add(row);
            }
        }
        List<JsonNode> added = new ArrayList<>();
        for (JsonNode row : toRows) {
            if (take(unmatched, JsonDocuments.canonicalJson(row))) {
                added.add(row);
            }
        }
        VersionDiff diff = new VersionDiff(datasetId, fromVersion, toVersion, added, removed, unchanged);
        LOG.debugf("Computed diff %s", diff);
        return diff;
    }

    private static boolean take(Map<String, Integer> counts, String key) {
        Integer count = counts.get(key);
        if (count == null) {
            return false;
        }
        if (count == 1) {
            counts.remove(key);
        } else {
            counts.put(key, count - 1);
        }
        return true;
    }

    private GlobalMirrorVersion requireVersion(String datasetId, String version) {
        GlobalMirrorVersion record = mirrorRepository.findVersion(datasetId, version);
        if (record == null) {
            throw EdgeStoreException.notFound("Version " + datasetId + "/" + version + " not found");
        }
        return record;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw EdgeStoreException.invalidArgument(field + " is required");
        }
    }
}
