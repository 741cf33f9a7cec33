package ai.pipestream.edge.service;

import ai.pipestream.edge.entity.ColumnType;
import ai.pipestream.edge.entity.UserDbTable;
import ai.pipestream.edge.entity.UserDbTableIndex;
import ai.pipestream.edge.entity.UserDocument;
import ai.pipestream.edge.entity.UserDocumentIndexEntry;
import ai.pipestream.edge.repository.UserDocumentRepository;
import ai.pipestream.edge.repository.UserTableRepository;
import ai.pipestream.edge.util.JsonDocuments;
import ai.pipestream.edge.util.JsonPath;
import ai.pipestream.edge.util.PhysicalTableNames;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * UserDB: tenant-defined JSON document tables with a declared primary-key path, a declared
 * timestamp path and typed secondary indexes over arbitrary JSON paths.
 * <p>
 * Documents live in the shared document table keyed by physical table name; every declared index
 * is kept in the index entry table and maintained by this service in the same transaction as the
 * document write. Writes to a key are last-writer-wins on the extracted timestamp unless
 * {@link UpsertMode#FORCE} is requested.
 * <p>
 * Locking: document writes hold the table's read lock, metadata changes (index creation, rebuild
 * and drop, table drop) hold its write lock, reads take no lock.
 */
@ApplicationScoped
public class UserTableService {

    private static final Logger LOG = Logger.getLogger(UserTableService.class);

    private static final Pattern COLUMN_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");
    private static final int MAX_PK_LENGTH = 191;
    private static final Pattern NUMERIC_TS = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Comparator<UserDocument> BY_PK = Comparator.comparing(d -> d.pk);

    @Inject
    UserTableRepository tables;

    @Inject
    UserDocumentRepository documents;

    @Inject
    TableLockRegistry locks;

    @Inject
    TransactionRunner transactions;

    @Inject
    AccessGuard accessGuard;

    @Inject
    ChangeEventPublisher events;

    @Inject
    Clock clock;

    @ConfigProperty(name = "edge.userdb.backfill-page-size", defaultValue = "200")
    int backfillPageSize;

    @ConfigProperty(name = "edge.userdb.scan-page-size", defaultValue = "500")
    int scanPageSize;

    @ConfigProperty(name = "edge.userdb.write-retries", defaultValue = "3")
    int writeRetries;

    @ConfigProperty(name = "edge.userdb.max-indexed-string-length", defaultValue = "255")
    int maxIndexedStringLength;

    // ========================================================================
    // Tables
    // ========================================================================

    /**
     * Register a table under a physical name derived from (userId, tableName).
     */
    public UserDbTable createTable(Capability capability, String userId, String tableName,
                                   String pkPath, String tsPath) {
        accessGuard.checkWrite(capability, "createTable");
        requireName(userId, "userId");
        requireName(tableName, "tableName");
        return createTable(capability, userId, tableName, PhysicalTableNames.derive(userId, tableName), pkPath, tsPath);
    }

    /**
     * Register a table.
     *
     * @param phyTable physical storage identifier, {@code [A-Za-z0-9_]{1,64}}
     * @param pkPath   JSON path of the primary key
     * @param tsPath   JSON path of the timestamp; null or blank for {@code $.updated_at}
     * @throws EdgeStoreException ALREADY_EXISTS if the table or the physical name is taken,
     *                            INVALID_PATH for a malformed path
     */
    public UserDbTable createTable(Capability capability, String userId, String tableName, String phyTable,
                                   String pkPath, String tsPath) {
        accessGuard.checkWrite(capability, "createTable");
        requireName(userId, "userId");
        requireName(tableName, "tableName");
        if (!PhysicalTableNames.isValid(phyTable)) {
            throw EdgeStoreException.invalidArgument("Invalid physical table name: " + phyTable);
        }
        String pk = compilePath(pkPath).expression();
        String ts = compilePath(tsPath == null || tsPath.isBlank() ? UserDbTable.DEFAULT_TS_PATH : tsPath).expression();

        try {
            return transactions.inTransaction("createTable", () -> {
                if (tables.findTable(userId, tableName) != null) {
                    throw EdgeStoreException.alreadyExists("Table " + tableName + " already exists for user " + userId);
                }
                if (tables.findByPhysicalName(phyTable) != null) {
                    throw EdgeStoreException.alreadyExists("Physical table " + phyTable + " is already in use");
                }
                return tables.createTable(userId, tableName, phyTable, pk, ts, clock.instant().getEpochSecond());
            });
        } catch (EdgeStoreException e) {
            if (e.kind() == ErrorKind.TRANSACTION_ABORTED && TransactionRunner.isConstraintViolation(e)) {
                throw new EdgeStoreException(ErrorKind.ALREADY_EXISTS,
                    "Table " + tableName + " was created concurrently for user " + userId, e);
            }
            throw e;
        }
    }

    public TableDescription describeTable(Capability capability, String userId, String tableName) {
        accessGuard.checkRead(capability, "describeTable");
        UserDbTable table = requireTable(userId, tableName);
        return new TableDescription(table, tables.listIndexes(userId, tableName),
            documents.countDocuments(table.phyTable));
    }

    public List<UserDbTable> listTables(Capability capability, String userId) {
        accessGuard.checkRead(capability, "listTables");
        return tables.listTables(userId);
    }

    /**
     * Drop a table: its documents, index entries, index definitions and the table record are
     * deleted in one transaction. Later operations on the table fail with NOT_FOUND.
     *
     * @return number of documents deleted
     */
    public long dropTable(Capability capability, String userId, String tableName) {
        accessGuard.checkWrite(capability, "dropTable");
        ReentrantReadWriteLock lock = locks.tableLock(userId, tableName);
        long removed;
        lock.writeLock().lock();
        try {
            removed = transactions.inTransaction("dropTable", () -> {
                UserDbTable table = requireTable(userId, tableName);
                long deleted = documents.deleteAllForTable(table.phyTable);
                tables.deleteTable(userId, tableName);
                return deleted;
            });
        } finally {
            lock.writeLock().unlock();
        }
        LOG.infof("Dropped table %s/%s (%d documents)", userId, tableName, removed);
        events.publish(EdgeChangeEvent.tableDropped(userId, tableName, removed));
        return removed;
    }

    // ========================================================================
    // Indexes
    // ========================================================================

    public UserDbTableIndex createIndex(Capability capability, String userId, String tableName,
                                        String colName, String jsonPath, String colType) {
        ColumnType type;
        try {
            type = ColumnType.fromWireName(colType);
        } catch (IllegalArgumentException e) {
            throw new EdgeStoreException(ErrorKind.INVALID_ARGUMENT, "Unknown column type: " + colType, e);
        }
        return createIndex(capability, userId, tableName, colName, jsonPath, type);
    }

    /**
     * Declare a typed index and backfill it from the table's existing documents.
     * <p>
     * The definition commits before the backfill starts. The backfill runs page by page; the
     * first document whose value does not match {@code colType} stops it with INVALID_PATH.
     * Entries written before that point are kept and the definition stays registered, so the
     * index is partial until the offending document is fixed and {@link #rebuildIndex} is run.
     *
     * @throws EdgeStoreException NOT_FOUND, ALREADY_EXISTS, INVALID_ARGUMENT (column name),
     *                            INVALID_PATH (malformed path or backfill type mismatch)
     */
    public UserDbTableIndex createIndex(Capability capability, String userId, String tableName,
                                        String colName, String jsonPath, ColumnType colType) {
        accessGuard.checkWrite(capability, "createIndex");
        if (colName == null || !COLUMN_NAME.matcher(colName).matches()) {
            throw EdgeStoreException.invalidArgument("Invalid index column name: " + colName);
        }
        if (colType == null) {
            throw EdgeStoreException.invalidArgument("Column type is required");
        }
        JsonPath path = compilePath(jsonPath);

        ReentrantReadWriteLock lock = locks.tableLock(userId, tableName);
        lock.writeLock().lock();
        try {
            UserDbTable table = requireTable(userId, tableName);
            UserDbTableIndex index;
            try {
                index = transactions.inTransaction("createIndex", () -> {
                    if (tables.findIndex(userId, tableName, colName) != null) {
                        throw EdgeStoreException.alreadyExists(
                            "Index " + colName + " already exists on " + userId + "/" + tableName);
                    }
                    return tables.createIndex(userId, tableName, colName, path.expression(), colType);
                });
            } catch (EdgeStoreException e) {
                if (e.kind() == ErrorKind.TRANSACTION_ABORTED && TransactionRunner.isConstraintViolation(e)) {
                    throw new EdgeStoreException(ErrorKind.ALREADY_EXISTS,
                        "Index " + colName + " was created concurrently on " + userId + "/" + tableName, e);
                }
                throw e;
            }
            backfill(table, index);
            return index;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Discard an index's entries and backfill it again from every document.
     *
     * @return number of entries written
     */
    public long rebuildIndex(Capability capability, String userId, String tableName, String colName) {
        accessGuard.checkWrite(capability, "rebuildIndex");
        ReentrantReadWriteLock lock = locks.tableLock(userId, tableName);
        lock.writeLock().lock();
        try {
            UserDbTable table = requireTable(userId, tableName);
            UserDbTableIndex index = requireIndex(userId, tableName, colName);
            long cleared = transactions.inTransaction("rebuildIndex",
                () -> documents.deleteEntriesForColumn(table.phyTable, colName));
            LOG.infof("Rebuilding index %s on %s/%s (%d stale entries cleared)", colName, userId, tableName, cleared);
            return backfill(table, index);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove an index definition and all of its entries.
     *
     * @return number of entries deleted
     */
    public long dropIndex(Capability capability, String userId, String tableName, String colName) {
        accessGuard.checkWrite(capability, "dropIndex");
        ReentrantReadWriteLock lock = locks.tableLock(userId, tableName);
        lock.writeLock().lock();
        try {
            long removed = transactions.inTransaction("dropIndex", () -> {
                UserDbTable table = requireTable(userId, tableName);
                requireIndex(userId, tableName, colName);
                tables.deleteIndex(userId, tableName, colName);
                return documents.deleteEntriesForColumn(table.phyTable, colName);
            });
            LOG.infof("Dropped index %s on %s/%s (%d entries)", colName, userId, tableName, removed);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private long backfill(UserDbTable table, UserDbTableIndex index) {
        JsonPath path = compilePath(index.jsonPath);
        long afterId = 0;
        long written = 0;
        long examined = 0;
        while (true) {
            long from = afterId;
            BackfillPage page = transactions.inTransaction("backfill",
                () -> backfillPage(table.phyTable, index, path, from));
            written += page.written;
            examined += page.examined;
            if (page.failure != null) {
                LOG.warnf("Backfill of index %s on %s/%s stopped after %d documents (%d entries kept): %s",
                    index.colName, table.userId, table.tableName, examined, written, page.failure);
                throw EdgeStoreException.invalidPath("Index " + index.colName + " (" + index.colType.wireName()
                    + " at " + index.jsonPath + ") rejects " + page.failure);
            }
            if (page.fetched < backfillPageSize) {
                break;
            }
            afterId = page.lastId;
        }
        LOG.infof("Backfilled index %s on %s/%s: %d entries from %d documents",
            index.colName, table.userId, table.tableName, written, examined);
        return written;
    }

    private BackfillPage backfillPage(String phyTable, UserDbTableIndex index, JsonPath path, long afterId) {
        List<UserDocument> page = documents.findDocumentsPage(phyTable, afterId, backfillPageSize);
        List<UserDocumentIndexEntry> entries = new ArrayList<>();
        long lastId = afterId;
        int examined = 0;
        String failure = null;
        for (UserDocument document : page) {
            IndexValue value;
            try {
                value = IndexValue.coerce(index.colType, path.read(JsonDocuments.parse(document.item)),
                    maxIndexedStringLength);
            } catch (IllegalArgumentException e) {
                failure = "document " + document.pk + ": " + e.getMessage();
                break;
            }
            examined++;
            lastId = document.id;
            if (value != null) {
                entries.add(value.toEntry(phyTable, index.colName, document.pk));
            }
        }
        documents.upsertEntries(phyTable, index.colName, entries);
        return new BackfillPage(page.size(), examined, entries.size(), lastId, failure);
    }

    // ========================================================================
    // Documents
    // ========================================================================

    public UpsertOutcome upsert(Capability capability, String userId, String tableName, JsonNode document) {
        return upsert(capability, userId, tableName, document, UpsertMode.LAST_WRITER_WINS);
    }

    /**
     * Insert or replace a document and its index entries atomically.
     *
     * @throws EdgeStoreException STALE_WRITE when the stored document is at least as new (LAST_WRITER_WINS),
     *                            INVALID_PATH when the primary key is missing, the timestamp is
     *                            unreadable or an indexed value has the wrong type
     */
    public UpsertOutcome upsert(Capability capability, String userId, String tableName,
                                JsonNode document, UpsertMode mode) {
        accessGuard.checkWrite(capability, "upsert");
        UpsertMode effectiveMode = mode == null ? UpsertMode.LAST_WRITER_WINS : mode;
        ReentrantReadWriteLock lock = locks.tableLock(userId, tableName);
        UpsertOutcome outcome;
        lock.readLock().lock();
        try {
            UserDbTable table = requireTable(userId, tableName);
            PendingWrite pending = prepare(table, tables.listIndexes(userId, tableName), document);
            outcome = write(table, pending, effectiveMode);
        } finally {
            lock.readLock().unlock();
        }
        if (!outcome.applied()) {
            LOG.warnf("Rejected stale write of %s/%s key %s at ts %d", userId, tableName, outcome.pk, outcome.ts);
            throw new EdgeStoreException(ErrorKind.STALE_WRITE,
                "Document " + outcome.pk + " in " + tableName + " has a timestamp >= " + outcome.ts);
        }
        LOG.debugf("Upserted %s/%s key %s (%s)", userId, tableName, outcome.pk, outcome.status);
        events.publish(EdgeChangeEvent.documentUpserted(userId, tableName, outcome.pk));
        return outcome;
    }

    /**
     * Write several documents, each in its own transaction. Every document is validated before
     * the first write; stale documents are reported in the outcomes instead of failing the batch.
     *
     * @return one outcome per document, in input order
     */
    public List<UpsertOutcome> upsertBatch(Capability capability, String userId, String tableName,
                                           List<? extends JsonNode> batch, UpsertMode mode) {
        accessGuard.checkWrite(capability, "upsertBatch");
        UpsertMode effectiveMode = mode == null ? UpsertMode.LAST_WRITER_WINS : mode;
        ReentrantReadWriteLock lock = locks.tableLock(userId, tableName);
        List<UpsertOutcome> outcomes = new ArrayList<>(batch.size());
        lock.readLock().lock();
        try {
            UserDbTable table = requireTable(userId, tableName);
            List<UserDbTableIndex> indexes = tables.listIndexes(userId, tableName);
            List<PendingWrite> pending = new ArrayList<>(batch.size());
            for (JsonNode document : batch) {
                pending.add(prepare(table, indexes, document));
            }
            for (PendingWrite write : pending) {
                outcomes.add(write(table, write, effectiveMode));
            }
        } finally {
            lock.readLock().unlock();
        }
        int applied = 0;
        for (UpsertOutcome outcome : outcomes) {
            if (outcome.applied()) {
                applied++;
                events.publish(EdgeChangeEvent.documentUpserted(userId, tableName, outcome.pk));
            }
        }
        LOG.infof("Batch upsert into %s/%s: %d applied, %d stale", userId, tableName,
            applied, outcomes.size() - applied);
        return outcomes;
    }

    /**
     * @throws EdgeStoreException NOT_FOUND if the table or the document does not exist
     */
    public UserDocument getDocument(Capability capability, String userId, String tableName, String pk) {
        accessGuard.checkRead(capability, "getDocument");
        UserDbTable table = requireTable(userId, tableName);
        UserDocument document = documents.findDocument(table.phyTable, pk);
        if (document == null) {
            throw EdgeStoreException.notFound("Document " + pk + " not found in " + userId + "/" + tableName);
        }
        return document;
    }

    /**
     * Delete documents and their index entries in one transaction. Unknown keys are ignored.
     *
     * @return number of documents deleted
     */
    public int deleteDocuments(Capability capability, String userId, String tableName, Collection<String> pks) {
        accessGuard.checkWrite(capability, "deleteDocuments");
        ReentrantReadWriteLock lock = locks.tableLock(userId, tableName);
        List<String> deleted;
        lock.readLock().lock();
        try {
            UserDbTable table = requireTable(userId, tableName);
            deleted = transactions.inTransaction("deleteDocuments", () -> {
                List<String> removed = new ArrayList<>();
                for (String pk : pks) {
                    if (documents.deleteDocument(table.phyTable, pk)) {
                        removed.add(pk);
                    }
                }
                return removed;
            });
        } finally {
            lock.readLock().unlock();
        }
        LOG.infof("Deleted %d of %d requested documents from %s/%s", deleted.size(), pks.size(), userId, tableName);
        for (String pk : deleted) {
            events.publish(EdgeChangeEvent.documentDeleted(userId, tableName, pk));
        }
        return deleted.size();
    }

    /**
     * Documents updated at or after {@code sinceTs} (epoch milliseconds), ordered by timestamp
     * then primary key.
     *
     * @param limit maximum number of documents (0 = no limit)
     */
    public List<UserDocument> scan(Capability capability, String userId, String tableName,
                                   long sinceTs, int limit, boolean ascending) {
        accessGuard.checkRead(capability, "scan");
        if (limit < 0) {
            throw EdgeStoreException.invalidArgument("Limit must not be negative: " + limit);
        }
        UserDbTable table = requireTable(userId, tableName);
        return documents.findUpdatedSince(table.phyTable, sinceTs, limit, ascending);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Equality query, {@code colName == value}.
     */
    public QueryResult query(Capability capability, String userId, String tableName, String colName, Object value) {
        return query(capability, userId, tableName, colName, QueryPredicate.eq(value));
    }

    /**
     * Find the documents whose value at {@code colName} satisfies {@code predicate}.
     * <p>
     * When {@code colName} names a declared index the lookup goes through its entries and the
     * operands are coerced to the index type. Otherwise {@code colName} is read as a JSON path
     * ({@code status} meaning {@code $.status}) and every document is scanned, comparing under
     * the type of the first operand; documents whose value has another type do not match.
     * Both access paths return documents ordered by primary key.
     */
    public QueryResult query(Capability capability, String userId, String tableName,
                             String colName, QueryPredicate predicate) {
        accessGuard.checkRead(capability, "query");
        if (predicate == null) {
            throw EdgeStoreException.invalidArgument("Predicate is required");
        }
        if (colName == null || colName.isBlank()) {
            throw EdgeStoreException.invalidArgument("Column is required");
        }
        UserDbTable table = requireTable(userId, tableName);
        UserDbTableIndex index = tables.findIndex(userId, tableName, colName);
        QueryResult result = index != null
            ? queryIndex(table, index, predicate)
            : queryScan(table, colName, predicate);
        LOG.debugf("Query %s/%s %s %s via %s: %d matches, %d examined", userId, tableName, colName,
            predicate, result.accessPath, result.documents.size(), result.examined);
        return result;
    }

    private QueryResult queryIndex(UserDbTable table, UserDbTableIndex index, QueryPredicate predicate) {
        List<IndexValue> operands = coerceOperands(index.colType, predicate, index.colName);
        QueryPredicate.Operator operator = predicate.operator();

        // String comparisons in the database follow its collation; only exact matches are
        // narrowed there and everything is re-checked below.
        List<UserDocumentIndexEntry> candidates;
        if (index.colType == ColumnType.STRING
            && operator != QueryPredicate.Operator.EQ && operator != QueryPredicate.Operator.IN) {
            candidates = documents.findEntries(table.phyTable, index.colName);
        } else {
            Object operand;
            if (operator == QueryPredicate.Operator.IN) {
                List<Object> values = new ArrayList<>(operands.size());
                for (IndexValue value : operands) {
                    values.add(value.storedValue());
                }
                operand = values;
            } else {
                operand = operands.get(0).storedValue();
            }
            candidates = documents.findEntriesMatching(table.phyTable, index.colName,
                IndexValue.entryAttribute(index.colType), operator.jpql(), operand);
        }

        List<String> pks = new ArrayList<>();
        for (UserDocumentIndexEntry entry : candidates) {
            if (predicate.test(IndexValue.fromEntry(index.colType, entry), operands)) {
                pks.add(entry.pk);
            }
        }
        List<UserDocument> matches = pks.isEmpty() ? new ArrayList<>() : documents.findDocuments(table.phyTable, pks);
        matches.sort(BY_PK);
        return new QueryResult(QueryResult.AccessPath.INDEX, matches, candidates.size());
    }

    private QueryResult queryScan(UserDbTable table, String colName, QueryPredicate predicate) {
        JsonPath path;
        try {
            path = JsonPath.fromFieldOrPath(colName);
        } catch (IllegalArgumentException e) {
            throw new EdgeStoreException(ErrorKind.INVALID_PATH, e.getMessage(), e);
        }
        ColumnType type = inferType(predicate.operands().get(0));
        List<IndexValue> operands = coerceOperands(type, predicate, colName);

        List<UserDocument> matches = new ArrayList<>();
        long examined = 0;
        long afterId = 0;
        while (true) {
            List<UserDocument> page = documents.findDocumentsPage(table.phyTable, afterId, scanPageSize);
            for (UserDocument document : page) {
                examined++;
                if (predicate.test(scanValue(type, path, document), operands)) {
                    matches.add(document);
                }
            }
            if (page.size() < scanPageSize) {
                break;
            }
            afterId = page.get(page.size() - 1).id;
        }
        matches.sort(BY_PK);
        return new QueryResult(QueryResult.AccessPath.FULL_SCAN, matches, examined);
    }

    private static IndexValue scanValue(ColumnType type, JsonPath path, UserDocument document) {
        JsonNode value = path.read(JsonDocuments.parse(document.item));
        try {
            return IndexValue.coerce(type, value, Integer.MAX_VALUE);
        } catch (IllegalArgumentException e) {
            // value of another type: not comparable, so not a match
            return null;
        }
    }

    private static ColumnType inferType(JsonNode operand) {
        if (operand.isTextual()) {
            return ColumnType.STRING;
        }
        if (operand.isBoolean()) {
            return ColumnType.BOOLEAN;
        }
        if (operand.isNumber()) {
            return ColumnType.NUMBER;
        }
        throw EdgeStoreException.invalidArgument("Query operands must be strings, numbers or booleans: " + operand);
    }

    private static List<IndexValue> coerceOperands(ColumnType type, QueryPredicate predicate, String colName) {
        List<IndexValue> values = new ArrayList<>(predicate.operands().size());
        for (JsonNode operand : predicate.operands()) {
            IndexValue value;
            try {
                value = IndexValue.coerce(type, operand, Integer.MAX_VALUE);
            } catch (IllegalArgumentException e) {
                throw new EdgeStoreException(ErrorKind.INVALID_ARGUMENT,
                    "Operand " + operand + " is not a valid " + type.wireName() + " for " + colName, e);
            }
            if (value == null) {
                throw EdgeStoreException.invalidArgument("Null operand for " + colName);
            }
            values.add(value);
        }
        return values;
    }

    // ========================================================================
    // Write path
    // ========================================================================

    private PendingWrite prepare(UserDbTable table, List<UserDbTableIndex> indexes, JsonNode document) {
        if (document == null || !document.isObject()) {
            throw EdgeStoreException.invalidArgument("Document must be a JSON object");
        }
        String pk = extractPk(table, document);
        long ts = extractTs(table, document);
        Map<String, IndexValue> values = new LinkedHashMap<>();
        for (UserDbTableIndex index : indexes) {
            JsonNode raw = compilePath(index.jsonPath).read(document);
            IndexValue value;
            try {
                value = IndexValue.coerce(index.colType, raw, maxIndexedStringLength);
            } catch (IllegalArgumentException e) {
                throw new EdgeStoreException(ErrorKind.INVALID_PATH, "Index " + index.colName + " ("
                    + index.colType.wireName() + " at " + index.jsonPath + ") rejects document " + pk
                    + ": " + e.getMessage(), e);
            }
            if (value != null) {
                values.put(index.colName, value);
            }
        }
        return new PendingWrite(pk, ts, JsonDocuments.toJson(document), values);
    }

    private UpsertOutcome write(UserDbTable table, PendingWrite pending, UpsertMode mode) {
        ReentrantLock keyLock = locks.keyLock(table.phyTable, pending.pk);
        keyLock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return transactions.inTransaction("upsert", () -> apply(table.phyTable, pending, mode));
                } catch (EdgeStoreException e) {
                    if (e.kind() != ErrorKind.TRANSACTION_ABORTED || !TransactionRunner.isConstraintViolation(e)
                        || attempt > writeRetries) {
                        throw e;
                    }
                    LOG.debugf("Concurrent first write of %s key %s, retrying (attempt %d)",
                        table.phyTable, pending.pk, attempt);
                }
            }
        } finally {
            keyLock.unlock();
        }
    }

    private UpsertOutcome apply(String phyTable, PendingWrite pending, UpsertMode mode) {
        UpsertOutcome.Status status;
        int updated = documents.compareAndSet(phyTable, pending.pk, pending.itemJson, pending.ts,
            mode == UpsertMode.FORCE);
        if (updated > 0) {
            status = UpsertOutcome.Status.UPDATED;
        } else if (documents.documentExists(phyTable, pending.pk)) {
            return new UpsertOutcome(pending.pk, pending.ts, UpsertOutcome.Status.STALE);
        } else {
            documents.insertDocument(phyTable, pending.pk, pending.itemJson, pending.ts);
            status = UpsertOutcome.Status.INSERTED;
        }
        documents.replaceEntries(phyTable, pending.pk, pending.entries(phyTable));
        return new UpsertOutcome(pending.pk, pending.ts, status);
    }

    /**
     * Primary key as text. Scalars are addressed by their text form, so {@code 1} and {@code "1"}
     * name the same document, as do {@code true} and {@code "true"}.
     */
    private static String extractPk(UserDbTable table, JsonNode document) {
        JsonNode node = compilePath(table.pkPath).read(document);
        if (node.isMissingNode() || node.isNull()) {
            throw EdgeStoreException.invalidPath("Document has no primary key at " + table.pkPath);
        }
        if (node.isContainerNode()) {
            throw EdgeStoreException.invalidPath("Primary key at " + table.pkPath + " must be a scalar");
        }
        String pk = node.asText();
        if (pk.isEmpty() || pk.length() > MAX_PK_LENGTH) {
            throw EdgeStoreException.invalidArgument("Primary key must have 1 to " + MAX_PK_LENGTH + " characters");
        }
        return pk;
    }

    /**
     * Timestamp in epoch milliseconds. A JSON number or a string of digits counts epoch seconds
     * and may carry a fraction down to the millisecond; an ISO-8601 date-time is read to the
     * millisecond. A document without one is stamped with the current time.
     */
    private long extractTs(UserDbTable table, JsonNode document) {
        JsonNode node = compilePath(table.tsPath).read(document);
        if (node.isMissingNode() || node.isNull()) {
            return clock.millis();
        }
        try {
            if (node.isNumber()) {
                return secondsToMillis(node.decimalValue());
            }
            if (node.isTextual()) {
                String text = node.textValue().trim();
                if (NUMERIC_TS.matcher(text).matches()) {
                    return secondsToMillis(new BigDecimal(text));
                }
                return IndexValue.parseEpochMillis(text);
            }
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new EdgeStoreException(ErrorKind.INVALID_PATH,
                "Unreadable timestamp at " + table.tsPath + ": " + node, e);
        }
        throw EdgeStoreException.invalidPath("Timestamp at " + table.tsPath + " must be a number or a date-time");
    }

    private static long secondsToMillis(BigDecimal seconds) {
        // throws ArithmeticException below millisecond precision or outside the long range
        return seconds.movePointRight(3).longValueExact();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private UserDbTable requireTable(String userId, String tableName) {
        UserDbTable table = tables.findTable(userId, tableName);
        if (table == null) {
            throw EdgeStoreException.notFound("Table " + tableName + " not found for user " + userId);
        }
        return table;
    }

    private UserDbTableIndex requireIndex(String userId, String tableName, String colName) {
        UserDbTableIndex index = tables.findIndex(userId, tableName, colName);
        if (index == null) {
            throw EdgeStoreException.notFound("Index " + colName + " not found on " + userId + "/" + tableName);
        }
        return index;
    }

    private static JsonPath compilePath(String expression) {
        try {
            return JsonPath.compile(expression);
        } catch (IllegalArgumentException e) {
            throw new EdgeStoreException(ErrorKind.INVALID_PATH, e.getMessage(), e);
        }
    }

    private static void requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw EdgeStoreException.invalidArgument(field + " is required");
        }
    }

    private static final class PendingWrite {
        final String pk;
        final long ts;
        final String itemJson;
        final Map<String, IndexValue> values;

        PendingWrite(String pk, long ts, String itemJson, Map<String, IndexValue> values) {
            this.pk = pk;
            this.ts = ts;
            this.itemJson = itemJson;
            this.values = values;
        }

        /**
         * Fresh entities on every call, so that a retried transaction never reuses managed state.
         */
        List<UserDocumentIndexEntry> entries(String phyTable) {
            List<UserDocumentIndexEntry> entries = new ArrayList<>(values.size());
            for (Map.Entry<String, IndexValue> value : values.entrySet()) {
                entries.add(value.getValue().toEntry(phyTable, value.getKey(), pk));
            }
            return entries;
        }
    }

    private static final class BackfillPage {
        final int fetched;
        final int examined;
        final int written;
        final long lastId;
        final String failure;

        BackfillPage(int fetched, int examined, int written, long lastId, String failure) {
            this.fetched = fetched;
            this.examined = examined;
            this.written = written;
            this.lastId = lastId;
            this.failure = failure;
        }
    }
}
