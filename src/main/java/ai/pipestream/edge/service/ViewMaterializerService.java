package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.GlobalMirrorVersion;
import ai.pipestream.edge.entity.GlobalRow;
import ai.pipestream.edge.entity.UserContext;
import ai.pipestream.edge.entity.UserView;
import ai.pipestream.edge.repository.GlobalMirrorRepository;
import ai.pipestream.edge.repository.UserContextRepository;
import ai.pipestream.edge.repository.UserViewRepository;
import ai.pipestream.edge.util.JsonDocuments;
import ai.pipestream.edge.util.JsonPath;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materializes personalized views: the latest version of a dataset, passed through the dataset's
 * {@link ViewTransform} with the user's context, appended to the user's view log.
 * <p>
 * The view log is append-only. Each run appends a full copy stamped with the run's time, so
 * readers select by version and timestamp; {@link #getLatestView} derives the newest item per key.
 */
@ApplicationScoped
public class ViewMaterializerService {

    private static final Logger LOG = Logger.getLogger(ViewMaterializerService.class);

    @Inject
    GlobalMirrorRepository mirrorRepository;

    @Inject
    UserContextRepository contextRepository;

    @Inject
    UserViewRepository viewRepository;

    @Inject
    ViewTransformRegistry transformRegistry;

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

    public MaterializationResult materializeView(Capability capability, String userId, String datasetId) {
        return materializeView(capability, userId, datasetId, null);
    }

    /**
     * Derive the user's view of the latest dataset version and append it to the view log, all in
     * one transaction. The version is resolved once at the start and every appended row carries it.
     *
     * @param timeout transaction timeout, or null for {@code edge.tx.timeout-seconds}
     * @throws EdgeStoreException NOT_FOUND if the dataset has no version,
     *                            TRANSACTION_ABORTED if the run fails or times out
     */
    public MaterializationResult materializeView(Capability capability, String userId, String datasetId,
                                                 Duration timeout) {
        accessGuard.checkWrite(capability, "materializeView");
        if (userId == null || userId.isBlank() || datasetId == null || datasetId.isBlank()) {
            throw EdgeStoreException.invalidArgument("userId and datasetId are required");
        }
        ViewTransform transform = transformRegistry.transformFor(datasetId);

        MaterializationResult result = transactions.inTransaction(
            "materializeView " + userId + "/" + datasetId, timeout, () -> {
                GlobalMirrorVersion latest = mirrorRepository.findLatestVersion(datasetId);
                if (latest == null) {
                    throw EdgeStoreException.notFound("Dataset " + datasetId + " has no published version");
                }
                UserContext stored = contextRepository.find(userId, datasetId);
                ObjectNode ctx = stored == null
                    ? JsonDocuments.mapper().createObjectNode()
                    : JsonDocuments.parseObject(stored.ctx);

                List<JsonNode> items = derive(transform, datasetId, latest.version, ctx);
                sort(items, ctx.path("sort"));

                List<String> itemsJson = new ArrayList<>(items.size());
                for (JsonNode item : items) {
                    itemsJson.add(JsonDocuments.toJson(item));
                }
                long now = clock.instant().getEpochSecond();
                int appended = viewRepository.append(userId, datasetId, latest.version, itemsJson, now);
                return new MaterializationResult(userId, datasetId, latest.version, latest.checksum, now, appended);
            });

        LOG.infof("Materialized view %s with %s", result, transform.getClass().getSimpleName());
        events.publish(EdgeChangeEvent.viewMaterialized(userId, datasetId, result.version, result.appended));
        return result;
    }

    /**
     * View rows of a version with {@code ts >= sinceTs}, ordered by ts then insertion order.
     */
    public List<UserView> getView(Capability capability, String userId, String datasetId, String version,
                                  long sinceTs) {
        accessGuard.checkRead(capability, "getView");
        List<UserView> rows = viewRepository.findSince(userId, datasetId, version, sinceTs, 0);
        LOG.debugf("Read %d view rows for %s/%s@%s since %d", rows.size(), userId, datasetId, version, sinceTs);
        return rows;
    }

    /**
     * The newest item per key in a version's view log. Items are keyed by the value at
     * {@code keyPath}; items without one are skipped. Result order follows the log position of
     * each key's newest item.
     */
    public List<JsonNode> getLatestView(Capability capability, String userId, String datasetId, String version,
                                        String keyPath) {
        accessGuard.checkRead(capability, "getLatestView");
        JsonPath path;
        try {
            path = JsonPath.fromFieldOrPath(keyPath);
        } catch (IllegalArgumentException e) {
            throw new EdgeStoreException(ErrorKind.INVALID_PATH, e.getMessage(), e);
        }
        Map<String, JsonNode> latest = new LinkedHashMap<>();
        for (UserView row : viewRepository.findSince(userId, datasetId, version, Long.MIN_VALUE, 0)) {
            JsonNode item = JsonDocuments.parse(row.item);
            JsonNode key = path.read(item);
            if (key.isMissingNode() || key.isNull()) {
                continue;
            }
            String keyText = key.isValueNode() ? key.asText() : JsonDocuments.toJson(key);
            latest.remove(keyText);
            latest.put(keyText, item);
        }
        return new ArrayList<>(latest.values());
    }

    private List<JsonNode> derive(ViewTransform transform, String datasetId, String version, ObjectNode ctx) {
        List<JsonNode> items = new ArrayList<>();
        long afterId = 0;
        while (true) {
            List<GlobalRow> page = mirrorRepository.findRowsPage(datasetId, version, afterId, rowPageSize);
            for (GlobalRow row : page) {
                JsonNode item;
                try {
                    item = transform.derive(JsonDocuments.parse(row.item), ctx);
                } catch (RuntimeException e) {
                    throw new EdgeStoreException(ErrorKind.TRANSACTION_ABORTED, "View transform "
                        + transform.getClass().getSimpleName() + " failed on row " + row.id + " of "
                        + datasetId + "/" + version, e);
                }
                if (item != null) {
                    items.add(item);
                }
            }
            if (page.size() < rowPageSize) {
                return items;
            }
            afterId = page.get(page.size() - 1).id;
        }
    }

    /**
     * Apply {@code {"by": field, "desc": bool}}. Rows missing the field sort last in either
     * direction; the sort is stable.
     */
    static void sort(List<JsonNode> items, JsonNode sort) {
        if (!sort.isObject() || !sort.path("by").isTextual()) {
            return;
        }
        String by = sort.path("by").textValue();
        boolean descending = sort.path("desc").asBoolean(false);
        Comparator<JsonNode> byValue = ViewMaterializerService::compareValues;
        Comparator<JsonNode> order = descending ? byValue.reversed() : byValue;
        items.sort((a, b) -> {
            JsonNode left = a.path(by);
            JsonNode right = b.path(by);
            boolean leftAbsent = left.isMissingNode() || left.isNull();
            boolean rightAbsent = right.isMissingNode() || right.isNull();
            if (leftAbsent || rightAbsent) {
                return Boolean.compare(leftAbsent, rightAbsent);
            }
            return order.compare(left, right);
        });
    }

    private static int compareValues(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        if (a.isBoolean() && b.isBoolean()) {
            return Boolean.compare(a.booleanValue(), b.booleanValue());
        }
        if (a.getNodeType() != b.getNodeType()) {
            return a.getNodeType().compareTo(b.getNodeType());
        }
        return a.asText().compareTo(b.asText());
    }
}
